package com.flagship.wallet_ledger.exception;

public class CounterpartyNotFoundException extends LedgerException {

    public CounterpartyNotFoundException(String message) {
        super("COUNTERPARTY_NOT_FOUND", message, false);
    }
}
