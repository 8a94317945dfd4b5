package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowStore;
import com.flagship.vault_ledger.observability.LedgerMetrics;
import com.flagship.vault_ledger.vault.Vault;
import com.flagship.vault_ledger.wallet.Wallet;
import com.flagship.vault_ledger.wallet.WalletStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Previews and persists the balance effects of leg changes.
 *
 * Every touched wallet and flow row is locked ({@code SELECT ... FOR UPDATE})
 * in id order before it is read, so two postings on the same target are
 * serialized by PostgreSQL and never lose an update. The cap checks come from
 * {@link CashFlow#applyLegChange(long, long)}; the values it returns are the
 * ones written by {@link #persist(BalancePreview)}.
 *
 * Both methods join the caller's transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceEngine {

    private final WalletStore walletStore;
    private final CashFlowStore cashFlowStore;
    private final LedgerMetrics metrics;

    /**
     * @throws LedgerException KEY_NOT_FOUND for a target outside the vault,
     *         CURRENCY_MISMATCH for a target in another currency,
     *         MAX_BALANCE_REACHED when a flow cap would be exceeded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BalancePreview preview(Vault vault, List<BalanceUpdate> updates) {
        Map<UUID, Wallet> wallets = new LinkedHashMap<>();
        Map<UUID, CashFlow> flows = new LinkedHashMap<>();

        // Lock in a stable order to avoid deadlocks between concurrent postings
        updates.stream()
            .map(BalanceUpdate::getTarget)
            .distinct()
            .sorted(Comparator.comparing((LegTarget t) -> t.getKind().ordinal()).thenComparing(LegTarget::getId))
            .forEach(target -> load(vault, target, wallets, flows));

        for (BalanceUpdate update : updates) {
            UUID id = update.getTarget().getId();
            switch (update.getTarget().getKind()) {
                case WALLET:
                    wallets.put(id, wallets.get(id).applyLegChange(update.getOldAmountMinor(), update.getNewAmountMinor()));
                    break;
                case FLOW:
                    flows.put(id, applyFlowChange(flows.get(id), update));
                    break;
                default:
                    throw new IllegalStateException("Unknown leg target: " + update.getTarget());
            }
        }

        return new BalancePreview(wallets, flows);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void persist(BalancePreview preview) {
        preview.getWallets().values()
            .forEach(wallet -> walletStore.updateBalance(wallet.getId(), wallet.getBalance()));
        preview.getFlows().values()
            .forEach(cashFlowStore::updateBalances);
    }

    private CashFlow applyFlowChange(CashFlow flow, BalanceUpdate update) {
        try {
            return flow.applyLegChange(update.getOldAmountMinor(), update.getNewAmountMinor());
        } catch (LedgerException e) {
            if (e.getKind() == ErrorKind.MAX_BALANCE_REACHED) {
                metrics.recordCapRejected();
                log.warn("Cap reached on flow {}: balance={}, mode={}, change={}->{}",
                    flow.getName(), flow.getBalance(), flow.getCapMode(),
                    update.getOldAmountMinor(), update.getNewAmountMinor());
            }
            throw e;
        }
    }

    private void load(Vault vault, LegTarget target, Map<UUID, Wallet> wallets, Map<UUID, CashFlow> flows) {
        switch (target.getKind()) {
            case WALLET: {
                Wallet wallet = walletStore.findInVaultForUpdate(vault.getId(), target.getId())
                    .orElseThrow(() -> LedgerException.keyNotFound("wallet not exists"));
                if (wallet.getCurrency() != vault.getCurrency()) {
                    throw LedgerException.currencyMismatch(
                        "wallet " + wallet.getName() + " is in " + wallet.getCurrency().code());
                }
                wallets.put(wallet.getId(), wallet);
                break;
            }
            case FLOW: {
                CashFlow flow = cashFlowStore.findInVaultForUpdate(vault.getId(), target.getId())
                    .orElseThrow(() -> LedgerException.keyNotFound("cash_flow not exists"));
                if (flow.getCurrency() != vault.getCurrency()) {
                    throw LedgerException.currencyMismatch(
                        "cash_flow " + flow.getName() + " is in " + flow.getCurrency().code());
                }
                flows.put(flow.getId(), flow);
                break;
            }
            default:
                throw new IllegalStateException("Unknown leg target: " + target);
        }
    }
}
