package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.money.Currency;
import lombok.Value;

import java.util.UUID;

/**
 * One signed balance effect of a transaction on a wallet or a cash flow.
 * Legs are the only rows that ever change a balance.
 */
@Value
public class Leg {
    UUID id;
    UUID transactionId;
    LegTarget target;
    long amountMinor;
    Currency currency;
    String attributedUserId;
}
