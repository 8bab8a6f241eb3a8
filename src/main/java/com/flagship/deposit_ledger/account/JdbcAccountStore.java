package com.flagship.deposit_ledger.account;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link AccountStore} against the {@code accounts} table.
 *
 * Joins whatever transaction is bound to the current thread; it never opens one itself.
 */
@Component
@Slf4j
public class JdbcAccountStore implements AccountStore {

    private static final String SELECT_COLUMNS =
        "SELECT id, account_number, owner_id, account_type, balance, status, created_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long insert(long ownerId, String accountNumber, AccountType accountType) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO accounts (account_number, owner_id, account_type, balance, status, created_at) " +
            "VALUES (?, ?, ?, 0, ?, CURRENT_TIMESTAMP) RETURNING id",
            Long.class,
            accountNumber,
            ownerId,
            accountType.name(),
            AccountStatus.ACTIVE.name()
        );
        if (id == null) {
            throw new IllegalStateException("Database did not return an id for account " + accountNumber);
        }
        log.debug("Inserted account id={} type={}", id, accountType);
        return id;
    }

    @Override
    public Optional<Account> findById(long accountId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Account> findByIdAndOwner(long accountId, long ownerId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ? AND owner_id = ?",
                accountRowMapper(), accountId, ownerId)
            .stream()
            .findFirst();
    }

    @Override
    public List<Account> findByOwner(long ownerId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE owner_id = ? ORDER BY id",
            accountRowMapper(), ownerId);
    }

    @Override
    public boolean existsByOwnerAndType(long ownerId, AccountType accountType) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE owner_id = ? AND account_type = ?)",
            Boolean.class,
            ownerId,
            accountType.name()
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public boolean existsByAccountNumber(String accountNumber) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM accounts WHERE account_number = ?)",
            Boolean.class,
            accountNumber
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public int applyCredit(long accountId, BigDecimal amount) {
        return jdbcTemplate.update(
            "UPDATE accounts SET balance = balance + ? WHERE id = ? AND status = ?",
            amount,
            accountId,
            AccountStatus.ACTIVE.name()
        );
    }

    @Override
    public Optional<BigDecimal> findBalance(long accountId) {
        return jdbcTemplate.query("SELECT balance FROM accounts WHERE id = ?",
                (rs, rowNum) -> rs.getBigDecimal("balance"), accountId)
            .stream()
            .findFirst();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getString("account_number"),
            rs.getLong("owner_id"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getBigDecimal("balance"),
            AccountStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
