package com.flagship.wallet_ledger.exception;

public class TransactionNotFoundException extends LedgerException {

    public TransactionNotFoundException(String reference) {
        super("TRANSACTION_NOT_FOUND", "Transaction not found: " + reference, false);
    }
}
