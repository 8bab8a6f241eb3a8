package com.flagship.deposit_ledger.exception;

/**
 * The account does not exist, or exists but belongs to another owner.
 * Both cases carry the same message so ownership is never leaked.
 */
public class AccountNotFoundException extends LedgerException {

    public AccountNotFoundException() {
        super("Account not found");
    }
}
