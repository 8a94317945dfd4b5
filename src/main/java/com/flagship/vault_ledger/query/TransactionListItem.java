package com.flagship.vault_ledger.query;

import com.flagship.vault_ledger.ledger.LedgerTransaction;
import lombok.Value;

/**
 * A listed transaction with the signed amount it contributed to the listed
 * target: the leg amount for flow and wallet lists, the transaction's signed
 * amount for vault lists.
 */
@Value
public class TransactionListItem {
    LedgerTransaction transaction;
    long signedAmountMinor;
}
