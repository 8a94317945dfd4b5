package com.flagship.vault_ledger.flow;

import com.flagship.vault_ledger.exception.LedgerException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * How a cash flow bounds its balance.
 *
 * <ul>
 *   <li>{@link Kind#UNLIMITED}: no bound</li>
 *   <li>{@link Kind#NET_CAPPED}: {@code balance <= cap}</li>
 *   <li>{@link Kind#INCOME_CAPPED}: the running total of positive legs
 *       ({@code incomeTotal}) must stay {@code <= cap}; expenses never lower it</li>
 * </ul>
 *
 * Instances are only built through the factories, so an income total without
 * a cap cannot exist. The two nullable columns {@code max_balance} and
 * {@code income_balance} are produced and consumed only at the persistence
 * boundary ({@link #fromColumns}, {@link #maxBalance()}, {@link #incomeBalance()}).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CapMode {

    public enum Kind {
        UNLIMITED,
        NET_CAPPED,
        INCOME_CAPPED
    }

    private static final CapMode UNLIMITED = new CapMode(Kind.UNLIMITED, 0L, 0L);

    Kind kind;
    long cap;
    long incomeTotal;

    public static CapMode unlimited() {
        return UNLIMITED;
    }

    public static CapMode netCapped(long cap) {
        requirePositiveCap(cap);
        return new CapMode(Kind.NET_CAPPED, cap, 0L);
    }

    public static CapMode incomeCapped(long cap, long incomeTotal) {
        requirePositiveCap(cap);
        if (incomeTotal < 0) {
            throw LedgerException.invalidFlow("income_balance must be >= 0");
        }
        return new CapMode(Kind.INCOME_CAPPED, cap, incomeTotal);
    }

    /**
     * Builds a mode from a caller request.
     *
     * @param maxBalance the cap, or null for no cap
     * @param incomeCapped whether the cap applies to cumulative income
     * @param incomeTotal the income total to start from (income-capped only)
     * @throws LedgerException INVALID_FLOW when an income cap has no cap value
     *         or the cap is not positive
     */
    public static CapMode of(Long maxBalance, boolean incomeCapped, long incomeTotal) {
        if (maxBalance == null) {
            if (incomeCapped) {
                throw LedgerException.invalidFlow("income-capped flow requires a cap");
            }
            return unlimited();
        }
        return incomeCapped ? incomeCapped(maxBalance, incomeTotal) : netCapped(maxBalance);
    }

    public static CapMode fromColumns(Long maxBalance, Long incomeBalance) {
        if (maxBalance == null) {
            if (incomeBalance != null) {
                throw LedgerException.invalidFlow("income_balance requires max_balance");
            }
            return unlimited();
        }
        return incomeBalance == null ? netCapped(maxBalance) : incomeCapped(maxBalance, incomeBalance);
    }

    public Long maxBalance() {
        return kind == Kind.UNLIMITED ? null : cap;
    }

    public Long incomeBalance() {
        return kind == Kind.INCOME_CAPPED ? incomeTotal : null;
    }

    public boolean isIncomeCapped() {
        return kind == Kind.INCOME_CAPPED;
    }

    CapMode withIncomeTotal(long newIncomeTotal) {
        return new CapMode(Kind.INCOME_CAPPED, cap, newIncomeTotal);
    }

    private static void requirePositiveCap(long cap) {
        if (cap <= 0) {
            throw LedgerException.invalidFlow("max_balance must be > 0");
        }
    }
}
