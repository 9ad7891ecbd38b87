package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Caller input for {@link LedgerStore#create(TransactionDraft)}.
 *
 * {@code direction} may be left null for types with an inferred direction.
 * There is deliberately no total amount here: the store computes it.
 */
@Value
@Builder
public class TransactionDraft {
    UUID ownerUserId;
    TransactionType type;
    TransactionDirection direction;
    Long amount;
    @Builder.Default
    long fee = 0L;
    @Builder.Default
    long tax = 0L;
    @Builder.Default
    String currency = "INR";
    @Builder.Default
    TransactionStatus initialStatus = TransactionStatus.PENDING;
    @Builder.Default
    String initialReason = "Transaction initiated";
    @Builder.Default
    String actor = "system";
    PartyDetails senderDetails;
    PartyDetails receiverDetails;
    Long balanceBefore;
    Long balanceAfter;
    @Builder.Default
    boolean balanceAffecting = true;
    PaymentMethod paymentMethod;
    PaymentMethodDetails paymentMethodDetails;
    String externalReferenceId;
    String description;
    String remarks;
    String category;
    Map<String, String> metadata;
}
