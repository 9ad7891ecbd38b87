package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published when a ledger entry reaches a terminal status or is put on hold.
 *
 * Consumers (the wallet's realtime sync among them) deduplicate on
 * {@code eventId}. Amounts are minor units.
 */
@Value
public class LedgerTransactionEvent {
    UUID eventId;
    UUID ledgerEntryId;
    String transactionId;
    UUID ownerUserId;
    TransactionType type;
    TransactionDirection direction;
    TransactionStatus status;
    long amount;
    long totalAmount;
    String currency;
    Long balanceAfter;
    String reason;
    Instant occurredAt;

    public static final String AGGREGATE_TYPE = "LedgerTransaction";

    /**
     * Event type name, e.g. {@code LedgerTransactionCompleted}.
     */
    public String getEventType() {
        return eventTypeFor(status);
    }

    public static String eventTypeFor(TransactionStatus status) {
        return switch (status) {
            case COMPLETED -> "LedgerTransactionCompleted";
            case FAILED -> "LedgerTransactionFailed";
            case ON_HOLD -> "LedgerTransactionOnHold";
            case REFUNDED -> "LedgerTransactionRefunded";
            case CANCELLED -> "LedgerTransactionCancelled";
            case PENDING, PROCESSING -> "LedgerTransactionUpdated";
        };
    }

    public static LedgerTransactionEvent fromTransaction(LedgerTransaction transaction, String reason, Instant occurredAt) {
        return new LedgerTransactionEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getTransactionId(),
            transaction.getOwnerUserId(),
            transaction.getType(),
            transaction.getDirection(),
            transaction.getStatus(),
            transaction.getAmount(),
            transaction.getTotalAmount(),
            transaction.getCurrency(),
            transaction.getBalanceAfter(),
            reason,
            occurredAt
        );
    }
}
