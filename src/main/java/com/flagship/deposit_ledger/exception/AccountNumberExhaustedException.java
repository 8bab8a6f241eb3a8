package com.flagship.deposit_ledger.exception;

public class AccountNumberExhaustedException extends InternalFailureException {

    public AccountNumberExhaustedException(int attempts) {
        super("Could not generate a unique account number after " + attempts + " attempts");
    }
}
