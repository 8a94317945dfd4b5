package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.money.Currency;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to move money between two wallets or two cash flows of a vault.
 * Transfers carry no category.
 */
@Value
@Builder
public class TransferCommand {
    UUID vaultId;
    String userId;
    long amountMinor;
    UUID fromId;
    UUID toId;
    Currency currency;
    String note;
    String idempotencyKey;
    Instant occurredAt;
}
