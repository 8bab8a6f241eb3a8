package com.flagship.deposit_ledger.exception;

import com.flagship.deposit_ledger.account.AccountType;

/**
 * Thrown when an owner tries to open a second account of the same type.
 */
public class AccountConflictException extends LedgerException {

    private final AccountType accountType;

    public AccountConflictException(AccountType accountType) {
        super("You already have a " + accountType.label() + " account");
        this.accountType = accountType;
    }

    public AccountConflictException(AccountType accountType, Throwable cause) {
        super("You already have a " + accountType.label() + " account", cause);
        this.accountType = accountType;
    }

    public AccountType getAccountType() {
        return accountType;
    }
}
