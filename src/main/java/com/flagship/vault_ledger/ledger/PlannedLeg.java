package com.flagship.vault_ledger.ledger;

import lombok.Value;

/**
 * A leg before it is persisted: target and signed amount.
 */
@Value
public class PlannedLeg {
    LegTarget target;
    long amountMinor;
}
