package com.flagship.wallet_ledger.ledger;

/**
 * Effect of a ledger entry on its owner's balance.
 */
public enum TransactionDirection {
    DEBIT,
    CREDIT
}
