package com.flagship.wallet_ledger.exception;

/**
 * Bad input. Raised before anything is written.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message, false);
    }
}
