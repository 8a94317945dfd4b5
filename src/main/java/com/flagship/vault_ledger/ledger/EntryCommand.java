package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.money.Currency;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to record an income, an expense or a refund.
 *
 * {@code walletId} defaults to the vault's only active wallet and
 * {@code flowId} to Unallocated. {@code currency}, when given, must match the
 * vault currency. {@code occurredAt} defaults to now.
 */
@Value
@Builder
public class EntryCommand {
    UUID vaultId;
    String userId;
    long amountMinor;
    UUID walletId;
    UUID flowId;
    Currency currency;
    String category;
    String note;
    String idempotencyKey;
    Instant occurredAt;

    /**
     * Refunds only: the transaction being refunded, in the same vault.
     */
    UUID refundedTransactionId;
}
