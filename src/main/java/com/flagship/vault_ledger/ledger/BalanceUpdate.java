package com.flagship.vault_ledger.ledger;

import lombok.Value;

/**
 * A proposed change of the amount one leg books on its target.
 * Creation is {@code (target, 0, amount)}, void is {@code (target, amount, 0)}.
 */
@Value
public class BalanceUpdate {
    LegTarget target;
    long oldAmountMinor;
    long newAmountMinor;

    public static BalanceUpdate create(LegTarget target, long amountMinor) {
        return new BalanceUpdate(target, 0L, amountMinor);
    }

    public static BalanceUpdate reverse(LegTarget target, long amountMinor) {
        return new BalanceUpdate(target, amountMinor, 0L);
    }
}
