package com.flagship.vault_ledger.flow;

import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.money.Currency;
import com.flagship.vault_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A budget bucket inside a vault ("Vacation", "Emergency fund", ...).
 *
 * Instances are immutable snapshots of a {@code cash_flows} row. The balance
 * is only ever changed through {@link #applyLegChange(long, long)}, which is
 * used both to preview a mutation and to produce the values that get
 * persisted.
 */
@Value
@Builder(toBuilder = true)
public class CashFlow {

    public static final String UNALLOCATED_NAME = "Unallocated";

    UUID id;
    UUID vaultId;
    String name;
    SystemFlowKind systemKind;
    long balance;
    CapMode capMode;
    Currency currency;
    boolean archived;

    public boolean isUnallocated() {
        return systemKind == SystemFlowKind.UNALLOCATED;
    }

    public boolean isSystem() {
        return systemKind != null;
    }

    /**
     * Returns the flow as it would be after one of its legs changes from
     * {@code oldAmountMinor} to {@code newAmountMinor}.
     *
     * A new leg is {@code (0, amount)}, a voided leg is {@code (amount, 0)}.
     * Caps only block increases: a change that lowers the capped quantity is
     * always admissible. Pure function, no I/O.
     *
     * @param oldAmountMinor signed amount currently booked on this flow by the leg
     * @param newAmountMinor signed amount the leg will book after the change
     * @return the updated flow (balance and, when income-capped, income total)
     * @throws LedgerException MAX_BALANCE_REACHED carrying the flow name when a cap would be exceeded
     */
    public CashFlow applyLegChange(long oldAmountMinor, long newAmountMinor) {
        long newBalance = Money.addExact(Money.subtractExact(balance, oldAmountMinor), newAmountMinor);

        switch (capMode.getKind()) {
            case UNLIMITED:
                return toBuilder().balance(newBalance).build();

            case NET_CAPPED:
                if (newBalance > capMode.getCap() && newBalance > balance) {
                    throw LedgerException.maxBalanceReached(name);
                }
                return toBuilder().balance(newBalance).build();

            case INCOME_CAPPED:
                long incomeTotal = capMode.getIncomeTotal();
                long newIncomeTotal = Money.addExact(
                    Money.subtractExact(incomeTotal, incomeContribution(oldAmountMinor)),
                    incomeContribution(newAmountMinor));
                if (newIncomeTotal > capMode.getCap() && newIncomeTotal > incomeTotal) {
                    throw LedgerException.maxBalanceReached(name);
                }
                return toBuilder()
                    .balance(newBalance)
                    .capMode(capMode.withIncomeTotal(newIncomeTotal))
                    .build();

            default:
                throw new IllegalStateException("Unknown cap mode: " + capMode.getKind());
        }
    }

    private static long incomeContribution(long amountMinor) {
        return Math.max(amountMinor, 0L);
    }
}
