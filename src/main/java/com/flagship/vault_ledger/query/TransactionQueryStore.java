package com.flagship.vault_ledger.query;

import com.flagship.vault_ledger.ledger.LedgerTransaction;
import com.flagship.vault_ledger.ledger.LegTarget;
import com.flagship.vault_ledger.ledger.TransactionKind;
import com.flagship.vault_ledger.ledger.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Keyset-paginated reads over {@code transactions}, newest first by
 * {@code (occurred_at DESC, id DESC)}.
 *
 * Callers pass {@code limit + 1} as the fetch size to detect a further page.
 */
@Repository
@RequiredArgsConstructor
public class TransactionQueryStore {

    private static final String ORDER_AND_LIMIT = " ORDER BY t.occurred_at DESC, t.id DESC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    public List<TransactionListItem> findForVault(UUID vaultId, TransactionFilter filter, Cursor after, int fetchSize) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(TransactionStore.TRANSACTION_COLUMNS)
            .append(" FROM transactions t WHERE t.vault_id = ?");
        args.add(vaultId);
        appendConditions(sql, args, filter, after);
        sql.append(ORDER_AND_LIMIT);
        args.add(fetchSize);

        RowMapper<LedgerTransaction> mapper = TransactionStore.transactionRowMapper();
        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            LedgerTransaction tx = mapper.mapRow(rs, rowNum);
            return new TransactionListItem(tx, tx.signedAmountMinor());
        }, args.toArray());
    }

    /**
     * Transactions with a leg on the given wallet or flow, each paired with
     * that leg's signed amount.
     */
    public List<TransactionListItem> findForTarget(UUID vaultId, LegTarget target, TransactionFilter filter,
                                                   Cursor after, int fetchSize) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
            .append(TransactionStore.TRANSACTION_COLUMNS)
            .append(", l.amount_minor AS leg_amount_minor")
            .append(" FROM legs l JOIN transactions t ON t.id = l.transaction_id")
            .append(" WHERE l.target_kind = ? AND l.target_id = ? AND t.vault_id = ?");
        args.add(target.getKind().dbValue());
        args.add(target.getId());
        args.add(vaultId);
        appendConditions(sql, args, filter, after);
        sql.append(ORDER_AND_LIMIT);
        args.add(fetchSize);

        RowMapper<LedgerTransaction> mapper = TransactionStore.transactionRowMapper();
        return jdbcTemplate.query(sql.toString(), (rs, rowNum) ->
            new TransactionListItem(mapper.mapRow(rs, rowNum), rs.getLong("leg_amount_minor")),
            args.toArray());
    }

    private void appendConditions(StringBuilder sql, List<Object> args, TransactionFilter filter, Cursor after) {
        if (filter.getFrom() != null) {
            sql.append(" AND t.occurred_at >= ?");
            args.add(TransactionStore.toTimestamp(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND t.occurred_at < ?");
            args.add(TransactionStore.toTimestamp(filter.getTo()));
        }
        if (!filter.isIncludeVoided()) {
            sql.append(" AND t.voided_at IS NULL");
        }
        if (filter.getKinds() != null) {
            sql.append(" AND t.kind IN (")
                .append(filter.getKinds().stream().map(k -> "?").collect(Collectors.joining(", ")))
                .append(")");
            filter.getKinds().forEach(k -> args.add(k.dbValue()));
        } else if (!filter.isIncludeTransfers()) {
            sql.append(" AND t.kind NOT IN (?, ?)");
            args.add(TransactionKind.TRANSFER_WALLET.dbValue());
            args.add(TransactionKind.TRANSFER_FLOW.dbValue());
        }
        if (after != null) {
            sql.append(" AND (t.occurred_at < ? OR (t.occurred_at = ? AND t.id < ?))");
            args.add(TransactionStore.toTimestamp(after.getOccurredAt()));
            args.add(TransactionStore.toTimestamp(after.getOccurredAt()));
            args.add(after.getTransactionId());
        }
    }
}
