package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.config.LedgerProperties;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CapMode;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowStore;
import com.flagship.vault_ledger.flow.SystemFlowKind;
import com.flagship.vault_ledger.ledger.TransactionKind;
import com.flagship.vault_ledger.membership.Role;
import com.flagship.vault_ledger.membership.VaultMembershipEntity;
import com.flagship.vault_ledger.membership.VaultMembershipRepository;
import com.flagship.vault_ledger.money.Currency;
import com.flagship.vault_ledger.money.Money;
import com.flagship.vault_ledger.observability.LedgerMdc;
import com.flagship.vault_ledger.support.Texts;
import com.flagship.vault_ledger.user.UserService;
import com.flagship.vault_ledger.wallet.Wallet;
import com.flagship.vault_ledger.wallet.WalletStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for creating, reading and deleting vaults.
 *
 * A new vault always starts with the system flow "Unallocated" and the
 * wallet "Cash", both at zero, and an owner membership for its creator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultService {

    private final VaultStore vaultStore;
    private final WalletStore walletStore;
    private final CashFlowStore cashFlowStore;
    private final VaultMembershipRepository vaultMembershipRepository;
    private final AccessControlService access;
    private final UserService userService;
    private final LedgerProperties properties;

    /**
     * Creates a vault.
     *
     * @param name display name, trimmed, unique per owner ignoring case
     * @param ownerUserId the creating user
     * @param currency vault currency, or null for the configured default
     * @return id of the new vault
     * @throws LedgerException EXISTING_KEY if the owner already has a vault with that name
     */
    @Transactional
    public UUID newVault(String name, String ownerUserId, Currency currency) {
        String normalized = Texts.requireName(name, "vault");
        userService.requireUser(ownerUserId);
        if (vaultStore.existsByOwnerAndName(ownerUserId, normalized)) {
            throw LedgerException.existingKey(normalized);
        }
        Currency vaultCurrency = currency != null ? currency : Currency.parse(properties.getDefaultCurrency());

        Vault vault = new Vault(UUID.randomUUID(), normalized, ownerUserId, vaultCurrency);
        try {
            vaultStore.insert(vault);
        } catch (DuplicateKeyException e) {
            throw LedgerException.existingKey(normalized);
        }

        cashFlowStore.insert(CashFlow.builder()
            .id(UUID.randomUUID())
            .vaultId(vault.getId())
            .name(CashFlow.UNALLOCATED_NAME)
            .systemKind(SystemFlowKind.UNALLOCATED)
            .balance(0L)
            .capMode(CapMode.unlimited())
            .currency(vaultCurrency)
            .archived(false)
            .build());

        walletStore.insert(Wallet.builder()
            .id(UUID.randomUUID())
            .vaultId(vault.getId())
            .name(Wallet.DEFAULT_NAME)
            .balance(0L)
            .currency(vaultCurrency)
            .archived(false)
            .build());

        vaultMembershipRepository.saveAndFlush(new VaultMembershipEntity(vault.getId(), ownerUserId, Role.OWNER));

        LedgerMdc.withVault(vault.getId(), () -> {
            log.info("Vault created: name={}, owner={}, currency={}", normalized, ownerUserId, vaultCurrency);
            return null;
        });
        return vault.getId();
    }

    /**
     * Deletes a vault and everything it owns in one unit of work.
     */
    @Transactional
    public void deleteVault(UUID vaultId, String userId) {
        access.requireVaultWrite(vaultId, userId);
        vaultStore.deleteCascade(vaultId);
        LedgerMdc.withVault(vaultId, () -> {
            log.info("Vault deleted by {}", userId);
            return null;
        });
    }

    @Transactional(readOnly = true)
    public VaultSnapshot vaultSnapshot(UUID vaultId, String userId) {
        return snapshot(access.requireVaultRead(vaultId, userId));
    }

    /**
     * Looks a vault up by name among the vaults the user can read.
     *
     * @throws LedgerException INVALID_AMOUNT if the name is ambiguous
     */
    @Transactional(readOnly = true)
    public VaultSnapshot vaultSnapshotByName(String name, String userId) {
        return snapshot(access.requireVaultReadByName(name, userId));
    }

    /**
     * Vaults the user owns or is a member of, ordered by name.
     */
    @Transactional(readOnly = true)
    public List<Vault> listVaults(String userId) {
        return vaultStore.findVisibleTo(userId);
    }

    /**
     * Computes the vault totals.
     *
     * @param includeVoided whether voided transactions count in income and expense totals
     * @return currency, sum of active wallet balances, total income, and
     *         total expenses minus refunds
     */
    @Transactional(readOnly = true)
    public VaultStatistics vaultStatistics(UUID vaultId, String userId, boolean includeVoided) {
        Vault vault = access.requireVaultRead(vaultId, userId);
        long balance = vaultStore.sumActiveWalletBalances(vaultId);
        long income = vaultStore.sumTransactionAmounts(vaultId, TransactionKind.INCOME.dbValue(), includeVoided);
        long expenses = vaultStore.sumTransactionAmounts(vaultId, TransactionKind.EXPENSE.dbValue(), includeVoided);
        long refunds = vaultStore.sumTransactionAmounts(vaultId, TransactionKind.REFUND.dbValue(), includeVoided);
        return new VaultStatistics(vault.getCurrency(), balance, income, Money.subtractExact(expenses, refunds));
    }

    private VaultSnapshot snapshot(Vault vault) {
        return new VaultSnapshot(
            vault,
            walletStore.findByVault(vault.getId()),
            cashFlowStore.findByVault(vault.getId()));
    }
}
