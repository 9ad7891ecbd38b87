package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable view of one ledger entry: a single debit or credit on one
 * owner's wallet.
 *
 * A transfer produces two of these, one per leg, each owned by a different
 * user. Amounts are minor units (paisa).
 *
 * {@code balanceBefore} and {@code balanceAfter} are an audit snapshot only;
 * the wallet balance is always read from the balance accessor.
 */
@Value
@Builder
public class LedgerTransaction {
    UUID id;
    String transactionId;
    UUID ownerUserId;
    TransactionType type;
    TransactionDirection direction;
    long amount;
    long fee;
    long tax;
    long totalAmount;
    String currency;
    TransactionStatus status;
    List<StatusHistoryEntry> statusHistory;
    PartyDetails senderDetails;
    PartyDetails receiverDetails;
    Long balanceBefore;
    Long balanceAfter;
    boolean balanceAffecting;
    PaymentMethod paymentMethod;
    PaymentMethodDetails paymentMethodDetails;
    String externalReferenceId;
    String gatewayReference;
    String description;
    String remarks;
    String category;
    ErrorDetails errorDetails;
    Map<String, String> metadata;
    Instant createdAt;
    Instant initiatedAt;
    Instant completedAt;
    Instant updatedAt;

    public boolean isOwnedBy(UUID userId) {
        return ownerUserId.equals(userId);
    }

    /**
     * Signed effect of this entry on the owner's balance.
     */
    public long signedTotal() {
        return direction == TransactionDirection.CREDIT ? totalAmount : -totalAmount;
    }
}
