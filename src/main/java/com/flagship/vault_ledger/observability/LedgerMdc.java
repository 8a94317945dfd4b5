package com.flagship.vault_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * MDC keys for engine operations.
 *
 * The vault id and transaction id are placed in the SLF4J MDC while an
 * operation runs, so every log line it emits (including those from nested
 * services) can be correlated. Keys are always removed when the operation
 * returns, even on failure.
 */
public final class LedgerMdc {

    public static final String VAULT_ID_MDC_KEY = "vaultId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

    private LedgerMdc() {
        // Utility class
    }

    /**
     * Runs an operation with the vault id in the MDC.
     * A value already present (outer operation) is restored afterwards.
     */
    public static <T> T withVault(UUID vaultId, Supplier<T> operation) {
        return with(VAULT_ID_MDC_KEY, vaultId, operation);
    }

    public static <T> T withTransaction(UUID transactionId, Supplier<T> operation) {
        return with(TRANSACTION_ID_MDC_KEY, transactionId, operation);
    }

    private static <T> T with(String key, UUID value, Supplier<T> operation) {
        String previous = MDC.get(key);
        if (value != null) {
            MDC.put(key, value.toString());
        }
        try {
            return operation.get();
        } finally {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        }
    }
}
