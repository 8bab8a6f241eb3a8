package com.flagship.deposit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Domain model for a row of the transaction log.
 *
 * Key invariant: a transaction is written once, in the same database
 * transaction that adjusts its account's balance, and never changed afterwards.
 */
@Value
public class LedgerTransaction {
    long id;
    long accountId;
    TransactionType type;
    BigDecimal amount;
    String description;
    TransactionStatus status;
    Instant createdAt;
    Instant processedAt;
}
