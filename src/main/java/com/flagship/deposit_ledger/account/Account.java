package com.flagship.deposit_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Domain model for a deposit account, as read from the accounts table.
 *
 * The balance is a materialized view of the account's completed transactions.
 * Instances are snapshots; they are never written back.
 */
@Value
public class Account {
    long id;
    String accountNumber;
    long ownerId;
    AccountType accountType;
    BigDecimal balance;
    AccountStatus status;
    Instant createdAt;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
