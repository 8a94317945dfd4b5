package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.money.Currency;
import lombok.Value;

/**
 * Totals of a vault.
 * {@code totalExpensesMinor} is net of refunds.
 */
@Value
public class VaultStatistics {
    Currency currency;
    long balanceMinor;
    long totalIncomeMinor;
    long totalExpensesMinor;
}
