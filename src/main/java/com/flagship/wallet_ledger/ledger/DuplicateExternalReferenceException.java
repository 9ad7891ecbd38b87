package com.flagship.wallet_ledger.ledger;

import lombok.Getter;

/**
 * Raised when an insert loses the race on the external reference unique key.
 * The processor answers it by returning the entry that won.
 */
@Getter
public class DuplicateExternalReferenceException extends RuntimeException {

    private final String externalReferenceId;

    public DuplicateExternalReferenceException(String externalReferenceId, Throwable cause) {
        super("Transaction already recorded for external reference " + externalReferenceId, cause);
        this.externalReferenceId = externalReferenceId;
    }
}
