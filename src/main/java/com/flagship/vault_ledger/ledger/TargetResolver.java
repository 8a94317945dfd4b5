package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowStore;
import com.flagship.vault_ledger.flow.SystemFlowKind;
import com.flagship.vault_ledger.vault.Vault;
import com.flagship.vault_ledger.wallet.Wallet;
import com.flagship.vault_ledger.wallet.WalletStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Resolves the wallet and flow a posting applies to when the caller leaves
 * them out.
 */
@Component
@RequiredArgsConstructor
public class TargetResolver {

    private final WalletStore walletStore;
    private final CashFlowStore cashFlowStore;

    /**
     * @param walletId explicit wallet, or null for the vault's only active wallet
     * @throws LedgerException KEY_NOT_FOUND if there is no such wallet,
     *         INVALID_AMOUNT if the default is ambiguous
     */
    public UUID resolveWalletId(Vault vault, UUID walletId) {
        if (walletId != null) {
            return requireWallet(vault, walletId).getId();
        }
        List<Wallet> active = walletStore.findActiveByVault(vault.getId());
        if (active.isEmpty()) {
            throw LedgerException.keyNotFound("missing wallet");
        }
        if (active.size() > 1) {
            throw LedgerException.invalidAmount("wallet_id is required when more than one wallet exists");
        }
        return active.get(0).getId();
    }

    /**
     * @param flowId explicit flow, or null for Unallocated
     */
    public UUID resolveFlowId(Vault vault, UUID flowId) {
        if (flowId != null) {
            return requireFlow(vault, flowId).getId();
        }
        return unallocated(vault).getId();
    }

    public Wallet requireWallet(Vault vault, UUID walletId) {
        return walletStore.findInVault(vault.getId(), walletId)
            .orElseThrow(() -> LedgerException.keyNotFound("wallet not exists"));
    }

    public CashFlow requireFlow(Vault vault, UUID flowId) {
        return cashFlowStore.findInVault(vault.getId(), flowId)
            .orElseThrow(() -> LedgerException.keyNotFound("cash_flow not exists"));
    }

    public CashFlow unallocated(Vault vault) {
        return cashFlowStore.findSystemFlow(vault.getId(), SystemFlowKind.UNALLOCATED)
            .orElseThrow(() -> LedgerException.keyNotFound("unallocated flow not exists"));
    }
}
