package com.flagship.wallet_ledger.ledger;

/**
 * Lifecycle state of a ledger entry.
 *
 * Transitions:
 * - PENDING → PROCESSING / ON_HOLD / FAILED / CANCELLED
 * - PROCESSING → COMPLETED / FAILED / CANCELLED / ON_HOLD
 * - ON_HOLD → PROCESSING / COMPLETED / FAILED / CANCELLED
 * - COMPLETED → REFUNDED
 *
 * FAILED, CANCELLED and REFUNDED are final. COMPLETED is final for funds
 * movement; the only way out of it is a refund.
 */
public enum TransactionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    REFUNDED,
    ON_HOLD;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == REFUNDED;
    }

    /**
     * Whether reaching this status is worth telling downstream consumers about.
     */
    public boolean isNotable() {
        return isTerminal() || this == ON_HOLD;
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == ON_HOLD
                    || target == FAILED || target == CANCELLED;
            case PROCESSING -> target == COMPLETED || target == FAILED
                    || target == CANCELLED || target == ON_HOLD;
            case ON_HOLD -> target == PROCESSING || target == COMPLETED
                    || target == FAILED || target == CANCELLED;
            case COMPLETED -> target == REFUNDED;
            case FAILED, CANCELLED, REFUNDED -> false;
        };
    }
}
