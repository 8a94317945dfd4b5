package com.flagship.vault_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * In-place amendment of a transaction. A null field keeps the current value.
 *
 * Text fields are trimmed and a blank value clears the field. Retargeting
 * fields are kind specific: {@code walletId}/{@code flowId} for income,
 * expense and refund, {@code fromWalletId}/{@code toWalletId} for wallet
 * transfers, {@code fromFlowId}/{@code toFlowId} for flow transfers.
 */
@Value
@Builder
public class UpdateTransactionCommand {
    UUID vaultId;
    UUID transactionId;
    String userId;
    Long amountMinor;
    UUID walletId;
    UUID flowId;
    UUID fromWalletId;
    UUID toWalletId;
    UUID fromFlowId;
    UUID toFlowId;
    String category;
    String note;
    Instant occurredAt;
}
