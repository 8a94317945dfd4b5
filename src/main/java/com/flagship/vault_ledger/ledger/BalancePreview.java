package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.wallet.Wallet;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Wallets and flows as they will be once a set of {@link BalanceUpdate}s is
 * applied. Produced before anything is written; persisted as is.
 */
@Value
public class BalancePreview {
    Map<UUID, Wallet> wallets;
    Map<UUID, CashFlow> flows;
}
