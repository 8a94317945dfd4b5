package com.flagship.vault_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions.created: transactions posted, tagged by kind
 * - ledger.transactions.voided
 * - ledger.transactions.updated
 * - ledger.idempotency: replays ("hit") and fresh requests ("miss")
 * - ledger.cap.rejected: mutations refused by a cash flow cap
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransactionCreated(String kind) {
        registry.counter("ledger.transactions.created", "kind", sanitizeTag(kind)).increment();
    }

    public void recordTransactionVoided(String kind) {
        registry.counter("ledger.transactions.voided", "kind", sanitizeTag(kind)).increment();
    }

    public void recordTransactionUpdated(String kind) {
        registry.counter("ledger.transactions.updated", "kind", sanitizeTag(kind)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    public void recordCapRejected() {
        registry.counter("ledger.cap.rejected").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
