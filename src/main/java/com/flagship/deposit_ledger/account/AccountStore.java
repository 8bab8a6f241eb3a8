package com.flagship.deposit_ledger.account;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of accounts.
 *
 * The only balance mutation offered is {@link #applyCredit}, a relative
 * adjustment evaluated by the database; the balance is never written as an
 * absolute value.
 */
public interface AccountStore {

    /**
     * Inserts a new account with a zero balance and ACTIVE status.
     *
     * @return the surrogate id assigned by the database
     * @throws org.springframework.dao.DuplicateKeyException if the owner already has
     *         an account of this type or the account number is taken
     */
    long insert(long ownerId, String accountNumber, AccountType accountType);

    Optional<Account> findById(long accountId);

    Optional<Account> findByIdAndOwner(long accountId, long ownerId);

    List<Account> findByOwner(long ownerId);

    boolean existsByOwnerAndType(long ownerId, AccountType accountType);

    boolean existsByAccountNumber(String accountNumber);

    /**
     * Adds {@code amount} to the balance of an ACTIVE account in a single
     * {@code balance = balance + ?} statement. The row stays locked until the
     * surrounding transaction ends.
     *
     * @return number of rows updated: 1 on success, 0 if the account is missing or not active
     */
    int applyCredit(long accountId, BigDecimal amount);

    Optional<BigDecimal> findBalance(long accountId);
}
