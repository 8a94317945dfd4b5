package com.flagship.vault_ledger.query;

import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Filter for transaction listings.
 *
 * {@code from} is inclusive and {@code to} exclusive. When {@code kinds} is
 * given it is an allow-list and {@code includeTransfers} is ignored.
 */
@Value
@Builder
public class TransactionFilter {

    public static final TransactionFilter NONE = TransactionFilter.builder().build();

    Instant from;
    Instant to;
    Set<TransactionKind> kinds;
    boolean includeVoided;
    boolean includeTransfers;

    /**
     * @throws LedgerException INVALID_AMOUNT for an empty window or an empty kind list
     */
    public void validate() {
        if (from != null && to != null && !from.isBefore(to)) {
            throw LedgerException.invalidAmount("invalid range: from must be < to");
        }
        if (kinds != null && kinds.isEmpty()) {
            throw LedgerException.invalidAmount("kinds must not be empty");
        }
    }
}
