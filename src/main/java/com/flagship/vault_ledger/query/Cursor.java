package com.flagship.vault_ledger.query;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Position of the last row of a page in {@code (occurred_at DESC, id DESC)} order.
 */
@Value
public class Cursor {
    Instant occurredAt;
    UUID transactionId;
}
