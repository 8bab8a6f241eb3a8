package com.flagship.deposit_ledger.account;

/**
 * Administrative state of an account. Only ACTIVE accounts accept funding.
 */
public enum AccountStatus {
    ACTIVE,
    FROZEN,
    CLOSED
}
