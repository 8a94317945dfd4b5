package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.wallet.Wallet;
import lombok.Value;

import java.util.List;

/**
 * A vault with all its wallets and cash flows (archived ones included).
 */
@Value
public class VaultSnapshot {
    Vault vault;
    List<Wallet> wallets;
    List<CashFlow> flows;
}
