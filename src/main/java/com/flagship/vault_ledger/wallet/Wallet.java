package com.flagship.vault_ledger.wallet;

import com.flagship.vault_ledger.money.Currency;
import com.flagship.vault_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A physical money container (cash, bank account, card).
 * Wallet balances have no bounds and may go negative.
 */
@Value
@Builder(toBuilder = true)
public class Wallet {

    public static final String DEFAULT_NAME = "Cash";

    UUID id;
    UUID vaultId;
    String name;
    long balance;
    Currency currency;
    boolean archived;

    public Wallet applyLegChange(long oldAmountMinor, long newAmountMinor) {
        long newBalance = Money.addExact(Money.subtractExact(balance, oldAmountMinor), newAmountMinor);
        return toBuilder().balance(newBalance).build();
    }
}
