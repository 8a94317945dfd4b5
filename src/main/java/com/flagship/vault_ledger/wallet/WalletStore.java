package com.flagship.vault_ledger.wallet;

import com.flagship.vault_ledger.money.Currency;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code wallets} table.
 *
 * Balances are denormalized running totals. They are written only by the
 * ledger engine, after reading the row {@code FOR UPDATE} in the same
 * transaction, so concurrent postings on one wallet are serialized by the
 * database.
 */
@Repository
@RequiredArgsConstructor
public class WalletStore {

    private static final String WALLET_COLUMNS = "id, vault_id, name, balance, currency, archived";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Wallet> findInVault(UUID vaultId, UUID walletId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ? AND vault_id = ?",
            walletRowMapper(),
            walletId, vaultId
        ).stream().findFirst();
    }

    public Optional<Wallet> findInVaultForUpdate(UUID vaultId, UUID walletId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ? AND vault_id = ? FOR UPDATE",
            walletRowMapper(),
            walletId, vaultId
        ).stream().findFirst();
    }

    public List<Wallet> findByVault(UUID vaultId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE vault_id = ? ORDER BY LOWER(name), id",
            walletRowMapper(),
            vaultId
        );
    }

    public List<Wallet> findActiveByVault(UUID vaultId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE vault_id = ? AND archived = FALSE ORDER BY LOWER(name), id",
            walletRowMapper(),
            vaultId
        );
    }

    /**
     * @param excludeWalletId wallet to ignore (the one being renamed), or null
     */
    public boolean existsByName(UUID vaultId, String name, UUID excludeWalletId) {
        Integer count = excludeWalletId == null
            ? jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM wallets WHERE vault_id = ? AND LOWER(name) = LOWER(?)",
                Integer.class, vaultId, name)
            : jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM wallets WHERE vault_id = ? AND LOWER(name) = LOWER(?) AND id <> ?",
                Integer.class, vaultId, name, excludeWalletId);
        return count != null && count > 0;
    }

    public void insert(Wallet wallet) {
        jdbcTemplate.update(
            "INSERT INTO wallets (id, vault_id, name, balance, currency, archived) VALUES (?, ?, ?, ?, ?, ?)",
            wallet.getId(),
            wallet.getVaultId(),
            wallet.getName(),
            wallet.getBalance(),
            wallet.getCurrency().code(),
            wallet.isArchived()
        );
    }

    public void updateBalance(UUID walletId, long balance) {
        jdbcTemplate.update("UPDATE wallets SET balance = ? WHERE id = ?", balance, walletId);
    }

    public void rename(UUID walletId, String name) {
        jdbcTemplate.update("UPDATE wallets SET name = ? WHERE id = ?", name, walletId);
    }

    public void setArchived(UUID walletId, boolean archived) {
        jdbcTemplate.update("UPDATE wallets SET archived = ? WHERE id = ?", archived, walletId);
    }

    /**
     * Sum of the non-voided legs booked on the wallet.
     */
    public long sumActiveLegs(UUID walletId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(l.amount_minor), 0) FROM legs l " +
            "JOIN transactions t ON t.id = l.transaction_id " +
            "WHERE l.target_kind = 'wallet' AND l.target_id = ? AND t.voided_at IS NULL",
            Long.class,
            walletId
        );
        return sum != null ? sum : 0L;
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> Wallet.builder()
            .id(UUID.fromString(rs.getString("id")))
            .vaultId(UUID.fromString(rs.getString("vault_id")))
            .name(rs.getString("name"))
            .balance(rs.getLong("balance"))
            .currency(Currency.parse(rs.getString("currency")))
            .archived(rs.getBoolean("archived"))
            .build();
    }
}
