package com.flagship.vault_ledger.vault;

import com.flagship.vault_ledger.money.Currency;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code vaults} table.
 */
@Repository
@RequiredArgsConstructor
public class VaultStore {

    private static final String VAULT_COLUMNS = "v.id, v.name, v.user_id, v.currency";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Vault> findById(UUID vaultId) {
        return jdbcTemplate.query(
            "SELECT " + VAULT_COLUMNS + " FROM vaults v WHERE v.id = ?",
            vaultRowMapper(),
            vaultId
        ).stream().findFirst();
    }

    /**
     * Vaults with the given name (ignoring case) that the user owns or is a member of.
     */
    public List<Vault> findVisibleByName(String name, String userId) {
        return jdbcTemplate.query(
            "SELECT " + VAULT_COLUMNS + " FROM vaults v " +
            "WHERE LOWER(v.name) = LOWER(?) " +
            "AND (v.user_id = ? OR EXISTS (" +
            "  SELECT 1 FROM vault_memberships m WHERE m.vault_id = v.id AND m.user_id = ?))",
            vaultRowMapper(),
            name, userId, userId
        );
    }

    public List<Vault> findVisibleTo(String userId) {
        return jdbcTemplate.query(
            "SELECT " + VAULT_COLUMNS + " FROM vaults v " +
            "WHERE v.user_id = ? OR EXISTS (" +
            "  SELECT 1 FROM vault_memberships m WHERE m.vault_id = v.id AND m.user_id = ?) " +
            "ORDER BY LOWER(v.name), v.id",
            vaultRowMapper(),
            userId, userId
        );
    }

    public boolean existsByOwnerAndName(String ownerUserId, String name) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM vaults WHERE user_id = ? AND LOWER(name) = LOWER(?)",
            Integer.class,
            ownerUserId, name
        );
        return count != null && count > 0;
    }

    public void insert(Vault vault) {
        jdbcTemplate.update(
            "INSERT INTO vaults (id, name, user_id, currency, created_at) VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            vault.getId(),
            vault.getName(),
            vault.getOwnerUserId(),
            vault.getCurrency().code()
        );
    }

    public long sumActiveWalletBalances(UUID vaultId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(balance), 0) FROM wallets WHERE vault_id = ? AND archived = FALSE",
            Long.class,
            vaultId
        );
        return sum != null ? sum : 0L;
    }

    /**
     * Sum of {@code amount_minor} over the vault's transactions of one kind.
     */
    public long sumTransactionAmounts(UUID vaultId, String kind, boolean includeVoided) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minor), 0) FROM transactions WHERE vault_id = ? AND kind = ?" +
            (includeVoided ? "" : " AND voided_at IS NULL"),
            Long.class,
            vaultId, kind
        );
        return sum != null ? sum : 0L;
    }

    /**
     * Deletes the vault and every row it owns, children first.
     */
    public void deleteCascade(UUID vaultId) {
        jdbcTemplate.update(
            "DELETE FROM flow_memberships WHERE flow_id IN (SELECT id FROM cash_flows WHERE vault_id = ?)",
            vaultId);
        jdbcTemplate.update("DELETE FROM vault_memberships WHERE vault_id = ?", vaultId);
        jdbcTemplate.update(
            "DELETE FROM legs WHERE transaction_id IN (SELECT id FROM transactions WHERE vault_id = ?)",
            vaultId);
        jdbcTemplate.update("DELETE FROM transactions WHERE vault_id = ?", vaultId);
        jdbcTemplate.update("DELETE FROM cash_flows WHERE vault_id = ?", vaultId);
        jdbcTemplate.update("DELETE FROM wallets WHERE vault_id = ?", vaultId);
        jdbcTemplate.update("DELETE FROM vaults WHERE id = ?", vaultId);
    }

    private RowMapper<Vault> vaultRowMapper() {
        return (rs, rowNum) -> new Vault(
            UUID.fromString(rs.getString("id")),
            rs.getString("name"),
            rs.getString("user_id"),
            Currency.parse(rs.getString("currency"))
        );
    }
}
