package com.flagship.wallet_ledger.exception;

/**
 * The external gateway declined the movement. The attempt is final; a new
 * attempt needs a new idempotency key.
 */
public class SettlementFailedException extends LedgerException {

    public SettlementFailedException(String message) {
        super("SETTLEMENT_FAILED", message, false);
    }
}
