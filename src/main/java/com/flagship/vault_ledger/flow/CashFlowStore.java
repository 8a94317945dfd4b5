package com.flagship.vault_ledger.flow;

import com.flagship.vault_ledger.money.Currency;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code cash_flows} table.
 *
 * The cap mode is persisted as the two nullable columns {@code max_balance}
 * and {@code income_balance}; {@link CapMode} converts at this boundary.
 */
@Repository
@RequiredArgsConstructor
public class CashFlowStore {

    private static final String FLOW_COLUMNS =
        "id, vault_id, name, system_kind, balance, max_balance, income_balance, currency, archived";

    private final JdbcTemplate jdbcTemplate;

    public Optional<CashFlow> findInVault(UUID vaultId, UUID flowId) {
        return jdbcTemplate.query(
            "SELECT " + FLOW_COLUMNS + " FROM cash_flows WHERE id = ? AND vault_id = ?",
            cashFlowRowMapper(),
            flowId, vaultId
        ).stream().findFirst();
    }

    public Optional<CashFlow> findInVaultForUpdate(UUID vaultId, UUID flowId) {
        return jdbcTemplate.query(
            "SELECT " + FLOW_COLUMNS + " FROM cash_flows WHERE id = ? AND vault_id = ? FOR UPDATE",
            cashFlowRowMapper(),
            flowId, vaultId
        ).stream().findFirst();
    }

    public Optional<CashFlow> findByName(UUID vaultId, String name) {
        return jdbcTemplate.query(
            "SELECT " + FLOW_COLUMNS + " FROM cash_flows WHERE vault_id = ? AND LOWER(name) = LOWER(?)",
            cashFlowRowMapper(),
            vaultId, name
        ).stream().findFirst();
    }

    public Optional<CashFlow> findSystemFlow(UUID vaultId, SystemFlowKind kind) {
        return jdbcTemplate.query(
            "SELECT " + FLOW_COLUMNS + " FROM cash_flows WHERE vault_id = ? AND system_kind = ?",
            cashFlowRowMapper(),
            vaultId, kind.dbValue()
        ).stream().findFirst();
    }

    public List<CashFlow> findByVault(UUID vaultId) {
        return jdbcTemplate.query(
            "SELECT " + FLOW_COLUMNS + " FROM cash_flows WHERE vault_id = ? " +
            "ORDER BY system_kind IS NULL, LOWER(name), id",
            cashFlowRowMapper(),
            vaultId
        );
    }

    /**
     * @param excludeFlowId flow to ignore (the one being renamed), or null
     */
    public boolean existsByName(UUID vaultId, String name, UUID excludeFlowId) {
        Integer count = excludeFlowId == null
            ? jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cash_flows WHERE vault_id = ? AND LOWER(name) = LOWER(?)",
                Integer.class, vaultId, name)
            : jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cash_flows WHERE vault_id = ? AND LOWER(name) = LOWER(?) AND id <> ?",
                Integer.class, vaultId, name, excludeFlowId);
        return count != null && count > 0;
    }

    public void insert(CashFlow flow) {
        jdbcTemplate.update(
            "INSERT INTO cash_flows (id, vault_id, name, system_kind, balance, max_balance, income_balance, currency, archived) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            flow.getId(),
            flow.getVaultId(),
            flow.getName(),
            flow.getSystemKind() != null ? flow.getSystemKind().dbValue() : null,
            flow.getBalance(),
            flow.getCapMode().maxBalance(),
            flow.getCapMode().incomeBalance(),
            flow.getCurrency().code(),
            flow.isArchived()
        );
    }

    /**
     * Persists balance and cap mode as produced by {@link CashFlow#applyLegChange(long, long)}.
     */
    public void updateBalances(CashFlow flow) {
        jdbcTemplate.update(
            "UPDATE cash_flows SET balance = ?, max_balance = ?, income_balance = ? WHERE id = ?",
            flow.getBalance(),
            flow.getCapMode().maxBalance(),
            flow.getCapMode().incomeBalance(),
            flow.getId()
        );
    }

    public void rename(UUID flowId, String name) {
        jdbcTemplate.update("UPDATE cash_flows SET name = ? WHERE id = ?", name, flowId);
    }

    public void setArchived(UUID flowId, boolean archived) {
        jdbcTemplate.update("UPDATE cash_flows SET archived = ? WHERE id = ?", archived, flowId);
    }

    public void delete(UUID flowId) {
        jdbcTemplate.update("DELETE FROM flow_memberships WHERE flow_id = ?", flowId);
        jdbcTemplate.update("DELETE FROM cash_flows WHERE id = ?", flowId);
    }

    public long countLegs(UUID flowId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM legs WHERE target_kind = 'flow' AND target_id = ?",
            Long.class,
            flowId
        );
        return count != null ? count : 0L;
    }

    /**
     * Sum of the non-voided legs booked on the flow.
     */
    public long sumActiveLegs(UUID flowId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(l.amount_minor), 0) FROM legs l " +
            "JOIN transactions t ON t.id = l.transaction_id " +
            "WHERE l.target_kind = 'flow' AND l.target_id = ? AND t.voided_at IS NULL",
            Long.class,
            flowId
        );
        return sum != null ? sum : 0L;
    }

    /**
     * Cumulative income of the flow: sum of its positive non-voided legs.
     */
    public long sumActivePositiveLegs(UUID flowId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(l.amount_minor), 0) FROM legs l " +
            "JOIN transactions t ON t.id = l.transaction_id " +
            "WHERE l.target_kind = 'flow' AND l.target_id = ? AND l.amount_minor > 0 AND t.voided_at IS NULL",
            Long.class,
            flowId
        );
        return sum != null ? sum : 0L;
    }

    private RowMapper<CashFlow> cashFlowRowMapper() {
        return (rs, rowNum) -> CashFlow.builder()
            .id(UUID.fromString(rs.getString("id")))
            .vaultId(UUID.fromString(rs.getString("vault_id")))
            .name(rs.getString("name"))
            .systemKind(SystemFlowKind.fromDbValue(rs.getString("system_kind")).orElse(null))
            .balance(rs.getLong("balance"))
            .capMode(CapMode.fromColumns(
                rs.getObject("max_balance", Long.class),
                rs.getObject("income_balance", Long.class)))
            .currency(Currency.parse(rs.getString("currency")))
            .archived(rs.getBoolean("archived"))
            .build();
    }
}
