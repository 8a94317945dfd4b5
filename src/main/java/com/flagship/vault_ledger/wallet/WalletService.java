package com.flagship.vault_ledger.wallet;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.ledger.EntryCommand;
import com.flagship.vault_ledger.ledger.LedgerService;
import com.flagship.vault_ledger.ledger.TargetResolver;
import com.flagship.vault_ledger.money.Money;
import com.flagship.vault_ledger.support.Texts;
import com.flagship.vault_ledger.vault.Vault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Service for managing wallets.
 *
 * Balances are never set directly: an opening balance is booked as an
 * ordinary income or expense against Unallocated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    static final String OPENING_CATEGORY = "opening";

    private final WalletStore walletStore;
    private final AccessControlService access;
    private final TargetResolver targets;
    private final LedgerService ledgerService;

    /**
     * Creates a wallet.
     *
     * @param openingBalanceMinor initial balance; positive is booked as income,
     *        negative as expense, zero books nothing
     * @return id of the new wallet
     * @throws LedgerException EXISTING_KEY if the name is taken in the vault
     */
    @Transactional
    public UUID newWallet(UUID vaultId, String userId, String name, long openingBalanceMinor) {
        Vault vault = access.requireVaultWrite(vaultId, userId);
        String normalized = Texts.requireName(name, "wallet");
        if (walletStore.existsByName(vaultId, normalized, null)) {
            throw LedgerException.existingKey(normalized);
        }

        Wallet wallet = Wallet.builder()
            .id(UUID.randomUUID())
            .vaultId(vaultId)
            .name(normalized)
            .balance(0L)
            .currency(vault.getCurrency())
            .archived(false)
            .build();
        try {
            walletStore.insert(wallet);
        } catch (DuplicateKeyException e) {
            throw LedgerException.existingKey(normalized);
        }

        if (openingBalanceMinor != 0) {
            EntryCommand opening = EntryCommand.builder()
                .vaultId(vaultId)
                .userId(userId)
                .amountMinor(openingBalanceMinor > 0 ? openingBalanceMinor : Money.negateExact(openingBalanceMinor))
                .walletId(wallet.getId())
                .category(OPENING_CATEGORY)
                .note("opening balance for wallet '" + normalized + "'")
                .build();
            if (openingBalanceMinor > 0) {
                ledgerService.income(opening);
            } else {
                ledgerService.expense(opening);
            }
        }

        log.info("Wallet created: vault={}, name={}, opening={}", vaultId, normalized, openingBalanceMinor);
        return wallet.getId();
    }

    /**
     * @throws LedgerException EXISTING_KEY if another wallet of the vault has the name
     */
    @Transactional
    public void renameWallet(UUID vaultId, String userId, UUID walletId, String newName) {
        Vault vault = access.requireVaultWrite(vaultId, userId);
        targets.requireWallet(vault, walletId);
        String normalized = Texts.requireName(newName, "wallet");
        if (walletStore.existsByName(vaultId, normalized, walletId)) {
            throw LedgerException.existingKey(normalized);
        }
        try {
            walletStore.rename(walletId, normalized);
        } catch (DuplicateKeyException e) {
            throw LedgerException.existingKey(normalized);
        }
    }

    /**
     * Archived wallets keep their history but are no longer picked as the
     * default wallet and are left out of the vault balance.
     */
    @Transactional
    public void setWalletArchived(UUID vaultId, String userId, UUID walletId, boolean archived) {
        Vault vault = access.requireVaultWrite(vaultId, userId);
        targets.requireWallet(vault, walletId);
        walletStore.setArchived(walletId, archived);
    }

    @Transactional(readOnly = true)
    public Wallet wallet(UUID vaultId, String userId, UUID walletId) {
        Vault vault = access.requireVaultRead(vaultId, userId);
        return targets.requireWallet(vault, walletId);
    }
}
