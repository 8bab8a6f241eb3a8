package com.flagship.deposit_ledger.exception;

/**
 * The store could not commit, or a post-commit read-back came back empty.
 *
 * Nothing from the failed attempt is committed, so callers may retry.
 */
public class InternalFailureException extends LedgerException {

    public InternalFailureException(String message) {
        super(message);
    }

    public InternalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
