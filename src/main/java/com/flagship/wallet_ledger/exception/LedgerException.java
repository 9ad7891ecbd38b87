package com.flagship.wallet_ledger.exception;

import lombok.Getter;

/**
 * Base type for every failure the wallet ledger reports to its callers.
 *
 * Each subtype carries a stable machine-readable code and tells the caller
 * whether resubmitting the same request may succeed. When the failure happened
 * after a ledger entry was created, the entry's human-facing transaction ID is
 * attached so the caller can point the user at the failed receipt.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final String code;
    private final boolean retryable;
    private String transactionId;

    protected LedgerException(String code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected LedgerException(String code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    /**
     * Attaches the transaction ID of the ledger entry this failure was recorded on.
     */
    public LedgerException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
