package com.flagship.wallet_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientFundsException extends LedgerException {

    private final UUID userId;
    private final long requestedMinor;

    public InsufficientFundsException(UUID userId, long requestedMinor) {
        super("INSUFFICIENT_FUNDS", "Insufficient balance", false);
        this.userId = userId;
        this.requestedMinor = requestedMinor;
    }
}
