package com.flagship.wallet_ledger.ledger;

import java.util.Optional;

/**
 * Kind of money movement a ledger entry records.
 *
 * Every type declared here has a fixed inferred direction. A type added with
 * a {@code null} direction has none, and drafts of that type must state their
 * direction explicitly or the store rejects them.
 */
public enum TransactionType {
    PAYMENT(TransactionDirection.DEBIT),
    TRANSFER(TransactionDirection.DEBIT),
    ADD_MONEY(TransactionDirection.CREDIT),
    WITHDRAWAL(TransactionDirection.DEBIT),
    RECHARGE(TransactionDirection.DEBIT),
    BILL_PAYMENT(TransactionDirection.DEBIT),
    REFUND(TransactionDirection.CREDIT),
    CASHBACK(TransactionDirection.CREDIT),
    LOAN_DISBURSEMENT(TransactionDirection.CREDIT),
    LOAN_REPAYMENT(TransactionDirection.DEBIT);

    private final TransactionDirection inferredDirection;

    TransactionType(TransactionDirection inferredDirection) {
        this.inferredDirection = inferredDirection;
    }

    public Optional<TransactionDirection> inferredDirection() {
        return Optional.ofNullable(inferredDirection);
    }
}
