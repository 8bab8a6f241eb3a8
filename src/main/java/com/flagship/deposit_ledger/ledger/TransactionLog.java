package com.flagship.deposit_ledger.ledger;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of monetary events per account.
 * There are no update or delete operations.
 */
public interface TransactionLog {

    /**
     * Appends a completed transaction and returns the id assigned by the database.
     */
    long append(long accountId, TransactionType type, BigDecimal amount, String description);

    Optional<LedgerTransaction> findById(long transactionId);

    /**
     * All transactions of the account, newest first, ties broken by descending id.
     */
    List<LedgerTransaction> findByAccountId(long accountId);
}
