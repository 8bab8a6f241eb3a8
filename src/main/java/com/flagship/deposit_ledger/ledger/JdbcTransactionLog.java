package com.flagship.deposit_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link TransactionLog} against the {@code transactions} table.
 */
@Component
@Slf4j
public class JdbcTransactionLog implements TransactionLog {

    private static final String SELECT_COLUMNS =
        "SELECT id, account_id, type, amount, description, status, created_at, processed_at FROM transactions ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcTransactionLog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long append(long accountId, TransactionType type, BigDecimal amount, String description) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO transactions (account_id, type, amount, description, status, created_at, processed_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) RETURNING id",
            Long.class,
            accountId,
            type.name(),
            amount,
            description,
            TransactionStatus.COMPLETED.name()
        );
        if (id == null) {
            throw new IllegalStateException("Database did not return an id for the new transaction");
        }
        log.debug("Appended {} transaction id={} to account {}", type, id, accountId);
        return id;
    }

    @Override
    public Optional<LedgerTransaction> findById(long transactionId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", transactionRowMapper(), transactionId)
            .stream()
            .findFirst();
    }

    @Override
    public List<LedgerTransaction> findByAccountId(long accountId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE account_id = ? ORDER BY created_at DESC, id DESC",
            transactionRowMapper(),
            accountId
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getLong("id"),
            rs.getLong("account_id"),
            TransactionType.valueOf(rs.getString("type")),
            rs.getBigDecimal("amount"),
            rs.getString("description"),
            TransactionStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            toInstant(rs.getTimestamp("processed_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
