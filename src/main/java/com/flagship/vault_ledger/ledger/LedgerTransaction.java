package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.money.Currency;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A posted transaction. {@code amountMinor} is the unsigned magnitude;
 * the signed effects live on the legs.
 */
@Value
@Builder
public class LedgerTransaction {
    UUID id;
    UUID vaultId;
    TransactionKind kind;
    Instant occurredAt;
    long amountMinor;
    Currency currency;
    String category;
    String note;
    String createdBy;
    Instant voidedAt;
    String voidedBy;
    UUID refundedTransactionId;
    String idempotencyKey;

    public boolean isVoided() {
        return voidedAt != null;
    }

    /**
     * Amount as it affects the vault total: negative for expenses,
     * positive for everything else.
     */
    public long signedAmountMinor() {
        return kind == TransactionKind.EXPENSE ? -amountMinor : amountMinor;
    }
}
