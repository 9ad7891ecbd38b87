package com.flagship.wallet_ledger.exception;

/**
 * Request is well-formed but not allowed, e.g. a self-transfer or a status
 * transition the state machine forbids.
 */
public class InvalidOperationException extends LedgerException {

    public InvalidOperationException(String message) {
        super("INVALID_OPERATION", message, false);
    }
}
