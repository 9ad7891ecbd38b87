package com.flagship.wallet_ledger.exception;

/**
 * PIN or biometric proof was rejected by the verification gate.
 * Never recorded in the ledger.
 */
public class AuthenticationException extends LedgerException {

    public AuthenticationException(String message) {
        super("AUTHENTICATION_FAILED", message, false);
    }
}
