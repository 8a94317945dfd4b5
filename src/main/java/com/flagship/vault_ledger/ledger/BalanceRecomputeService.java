package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.flow.CapMode;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowStore;
import com.flagship.vault_ledger.vault.Vault;
import com.flagship.vault_ledger.wallet.Wallet;
import com.flagship.vault_ledger.wallet.WalletStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rebuilds the denormalized wallet and flow balances of a vault from its
 * non-voided legs.
 *
 * Legs are the source of truth; the balance columns are a cache that the
 * engine keeps in step. This service repairs them after manual data fixes.
 * Each row is locked before its legs are summed, so a concurrent posting
 * either commits before the sum or waits for the repair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceRecomputeService {

    private final AccessControlService access;
    private final WalletStore walletStore;
    private final CashFlowStore cashFlowStore;

    /**
     * @return number of wallets and flows whose stored values were corrected
     */
    @Transactional
    public int recomputeBalances(UUID vaultId, String userId) {
        Vault vault = access.requireVaultWrite(vaultId, userId);
        int corrected = 0;

        // Same lock order as BalanceEngine: wallets before flows, each by id.
        List<UUID> walletIds = walletStore.findByVault(vault.getId()).stream()
            .map(Wallet::getId).sorted().collect(Collectors.toList());
        for (UUID walletId : walletIds) {
            Optional<Wallet> locked = walletStore.findInVaultForUpdate(vault.getId(), walletId);
            if (locked.isEmpty()) {
                continue;
            }
            Wallet wallet = locked.get();
            long expected = walletStore.sumActiveLegs(wallet.getId());
            if (expected != wallet.getBalance()) {
                log.warn("Wallet {} balance drift: stored={}, legs={}", wallet.getName(), wallet.getBalance(), expected);
                walletStore.updateBalance(wallet.getId(), expected);
                corrected++;
            }
        }

        List<UUID> flowIds = cashFlowStore.findByVault(vault.getId()).stream()
            .map(CashFlow::getId).sorted().collect(Collectors.toList());
        for (UUID flowId : flowIds) {
            Optional<CashFlow> locked = cashFlowStore.findInVaultForUpdate(vault.getId(), flowId);
            if (locked.isEmpty()) {
                continue;
            }
            CashFlow flow = locked.get();
            long expected = cashFlowStore.sumActiveLegs(flow.getId());
            CapMode mode = flow.getCapMode();
            if (mode.isIncomeCapped()) {
                mode = CapMode.incomeCapped(mode.getCap(), cashFlowStore.sumActivePositiveLegs(flow.getId()));
            }
            if (expected != flow.getBalance() || !mode.equals(flow.getCapMode())) {
                log.warn("Cash flow {} drift: stored balance={}, legs={}, mode {} -> {}",
                    flow.getName(), flow.getBalance(), expected, flow.getCapMode(), mode);
                cashFlowStore.updateBalances(flow.toBuilder().balance(expected).capMode(mode).build());
                corrected++;
            }
        }

        log.info("Balances recomputed for vault {}: {} corrected", vaultId, corrected);
        return corrected;
    }
}
