package com.flagship.deposit_ledger.ledger;

public enum TransactionType {
    DEPOSIT
}
