package com.flagship.deposit_ledger.ledger;

/**
 * Only completed transactions are modeled; they are the ones summed into the balance.
 */
public enum TransactionStatus {
    COMPLETED
}
