package com.flagship.deposit_ledger.exception;

/**
 * Base type for every failure the ledger reports to its callers.
 * Each subclass maps to exactly one entry of the error taxonomy.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
