package com.flagship.wallet_ledger.exception;

/**
 * The store could not be reached or rejected a write for infrastructure reasons.
 * Safe to retry.
 */
public class PersistenceException extends LedgerException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, true, cause);
    }

    public PersistenceException(String message) {
        super("PERSISTENCE_ERROR", message, true);
    }
}
