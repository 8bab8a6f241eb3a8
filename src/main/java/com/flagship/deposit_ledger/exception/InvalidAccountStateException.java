package com.flagship.deposit_ledger.exception;

import com.flagship.deposit_ledger.account.AccountStatus;

public class InvalidAccountStateException extends LedgerException {

    private final AccountStatus status;

    public InvalidAccountStateException(AccountStatus status) {
        super("Account is not active");
        this.status = status;
    }

    public AccountStatus getStatus() {
        return status;
    }
}
