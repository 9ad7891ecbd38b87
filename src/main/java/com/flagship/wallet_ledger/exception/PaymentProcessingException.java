package com.flagship.wallet_ledger.exception;

/**
 * Unexpected failure while funds were moving. The entry has been marked failed
 * (or on hold when compensation could not be completed).
 */
public class PaymentProcessingException extends LedgerException {

    public PaymentProcessingException(String message, Throwable cause) {
        super("PAYMENT_PROCESSING_ERROR", message, false, cause);
    }
}
