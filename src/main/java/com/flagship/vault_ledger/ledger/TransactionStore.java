package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.money.Currency;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code transactions} and {@code legs}.
 *
 * Rows are never deleted here: a posted transaction only changes through
 * {@link #markVoided} and {@link #updateHeader}/{@link #updateLeg}.
 */
@Repository
@RequiredArgsConstructor
public class TransactionStore {

    public static final String TRANSACTION_COLUMNS =
        "t.id, t.vault_id, t.kind, t.occurred_at, t.amount_minor, t.currency, t.category, t.note, " +
        "t.created_by, t.voided_at, t.voided_by, t.refunded_transaction_id, t.idempotency_key";

    private static final String LEG_COLUMNS =
        "id, transaction_id, target_kind, target_id, amount_minor, currency, attributed_user_id";

    private final JdbcTemplate jdbcTemplate;

    public Optional<LedgerTransaction> findById(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions t WHERE t.id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    /**
     * Locks the transaction row so that concurrent void/update calls on the
     * same transaction run one after the other.
     */
    public Optional<LedgerTransaction> findByIdForUpdate(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions t WHERE t.id = ? FOR UPDATE",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    public Optional<UUID> findIdByIdempotencyKey(UUID vaultId, String createdBy, String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT id FROM transactions WHERE vault_id = ? AND created_by = ? AND idempotency_key = ?",
            (rs, rowNum) -> UUID.fromString(rs.getString("id")),
            vaultId, createdBy, idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Inserts the transaction unless its idempotency key is already taken.
     *
     * {@code ON CONFLICT DO NOTHING} keeps the surrounding database
     * transaction usable when the unique index rejects the row, so the caller
     * can re-read the winner.
     *
     * @return true if the row was inserted, false on an idempotency conflict
     */
    public boolean insertIfAbsent(LedgerTransaction tx) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO transactions (id, vault_id, kind, occurred_at, amount_minor, currency, category, note, " +
            "created_by, refunded_transaction_id, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            tx.getId(),
            tx.getVaultId(),
            tx.getKind().dbValue(),
            toTimestamp(tx.getOccurredAt()),
            tx.getAmountMinor(),
            tx.getCurrency().code(),
            tx.getCategory(),
            tx.getNote(),
            tx.getCreatedBy(),
            tx.getRefundedTransactionId(),
            tx.getIdempotencyKey()
        );
        return inserted == 1;
    }

    public void insertLeg(Leg leg) {
        jdbcTemplate.update(
            "INSERT INTO legs (" + LEG_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
            leg.getId(),
            leg.getTransactionId(),
            leg.getTarget().getKind().dbValue(),
            leg.getTarget().getId(),
            leg.getAmountMinor(),
            leg.getCurrency().code(),
            leg.getAttributedUserId()
        );
    }

    public List<Leg> findLegs(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + LEG_COLUMNS + " FROM legs WHERE transaction_id = ? ORDER BY id",
            legRowMapper(),
            transactionId
        );
    }

    public void updateLeg(UUID legId, LegTarget target, long amountMinor) {
        jdbcTemplate.update(
            "UPDATE legs SET target_kind = ?, target_id = ?, amount_minor = ? WHERE id = ?",
            target.getKind().dbValue(),
            target.getId(),
            amountMinor,
            legId
        );
    }

    public void markVoided(UUID transactionId, Instant voidedAt, String voidedBy) {
        jdbcTemplate.update(
            "UPDATE transactions SET voided_at = ?, voided_by = ? WHERE id = ?",
            toTimestamp(voidedAt),
            voidedBy,
            transactionId
        );
    }

    public void updateHeader(UUID transactionId, long amountMinor, String category, String note, Instant occurredAt) {
        jdbcTemplate.update(
            "UPDATE transactions SET amount_minor = ?, category = ?, note = ?, occurred_at = ? WHERE id = ?",
            amountMinor,
            category,
            note,
            toTimestamp(occurredAt),
            transactionId
        );
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    public static RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            String refunded = rs.getString("refunded_transaction_id");
            return LedgerTransaction.builder()
                .id(UUID.fromString(rs.getString("id")))
                .vaultId(UUID.fromString(rs.getString("vault_id")))
                .kind(TransactionKind.fromDbValue(rs.getString("kind")))
                .occurredAt(toInstant(rs, "occurred_at"))
                .amountMinor(rs.getLong("amount_minor"))
                .currency(Currency.parse(rs.getString("currency")))
                .category(rs.getString("category"))
                .note(rs.getString("note"))
                .createdBy(rs.getString("created_by"))
                .voidedAt(toInstant(rs, "voided_at"))
                .voidedBy(rs.getString("voided_by"))
                .refundedTransactionId(refunded != null ? UUID.fromString(refunded) : null)
                .idempotencyKey(rs.getString("idempotency_key"))
                .build();
        };
    }

    private RowMapper<Leg> legRowMapper() {
        return (rs, rowNum) -> new Leg(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            LegTarget.of(
                LegTarget.Kind.fromDbValue(rs.getString("target_kind")),
                UUID.fromString(rs.getString("target_id"))),
            rs.getLong("amount_minor"),
            Currency.parse(rs.getString("currency")),
            rs.getString("attributed_user_id")
        );
    }
}
