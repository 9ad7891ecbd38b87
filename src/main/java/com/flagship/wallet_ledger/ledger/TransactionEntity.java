package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for a ledger entry.
 *
 * - No setters: after creation only {@link #applyStatus} mutates the row
 * - Creation goes through {@link #create}, which computes the total amount
 *   and seeds the history with the initial status
 * - History rows are cascaded on insert and ordered by sequence number
 */
@Entity
@Table(name = "ledger_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Version
    private Long version;

    @Column(name = "transaction_id", nullable = false, updatable = false, unique = true, length = 40)
    private String transactionId;

    @Column(name = "owner_user_id", nullable = false, updatable = false)
    private UUID ownerUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private TransactionDirection direction;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false)
    private long fee;

    @Column(nullable = false, updatable = false)
    private long tax;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private long totalAmount;

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransactionStatus status;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL)
    @OrderBy("sequenceNumber ASC")
    @BatchSize(size = 50)
    private List<StatusHistoryEntity> statusHistory = new ArrayList<>();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "userId", column = @Column(name = "sender_user_id", updatable = false)),
        @AttributeOverride(name = "name", column = @Column(name = "sender_name", updatable = false)),
        @AttributeOverride(name = "email", column = @Column(name = "sender_email", updatable = false)),
        @AttributeOverride(name = "phone", column = @Column(name = "sender_phone", updatable = false)),
        @AttributeOverride(name = "upiId", column = @Column(name = "sender_upi_id", updatable = false)),
        @AttributeOverride(name = "accountNumber", column = @Column(name = "sender_account_number", updatable = false))
    })
    private PartyDetails senderDetails;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "userId", column = @Column(name = "receiver_user_id", updatable = false)),
        @AttributeOverride(name = "name", column = @Column(name = "receiver_name", updatable = false)),
        @AttributeOverride(name = "email", column = @Column(name = "receiver_email", updatable = false)),
        @AttributeOverride(name = "phone", column = @Column(name = "receiver_phone", updatable = false)),
        @AttributeOverride(name = "upiId", column = @Column(name = "receiver_upi_id", updatable = false)),
        @AttributeOverride(name = "accountNumber", column = @Column(name = "receiver_account_number", updatable = false))
    })
    private PartyDetails receiverDetails;

    @Column(name = "balance_before", updatable = false)
    private Long balanceBefore;

    @Column(name = "balance_after")
    private Long balanceAfter;

    @Column(name = "balance_affecting", nullable = false, updatable = false)
    private boolean balanceAffecting;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 32)
    private PaymentMethod paymentMethod;

    @Embedded
    private PaymentMethodDetails paymentMethodDetails;

    @Column(name = "external_reference_id", updatable = false, unique = true, length = 128)
    private String externalReferenceId;

    @Column(name = "gateway_reference", length = 128)
    private String gatewayReference;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(updatable = false, length = 500)
    private String remarks;

    @Column(updatable = false, length = 64)
    private String category;

    @Embedded
    private ErrorDetails errorDetails;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(updatable = false, columnDefinition = "TEXT")
    private Map<String, String> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "initiated_at", nullable = false, updatable = false)
    private Instant initiatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Builds a new entry from a validated draft.
     *
     * @param draft caller input, already validated by the store
     * @param transactionId generated human-facing identifier
     * @param direction explicit or inferred direction
     * @param now creation instant
     */
    static TransactionEntity create(TransactionDraft draft, String transactionId,
                                    TransactionDirection direction, Instant now) {
        TransactionEntity entity = new TransactionEntity();
        entity.id = UUID.randomUUID();
        entity.transactionId = transactionId;
        entity.ownerUserId = draft.getOwnerUserId();
        entity.type = draft.getType();
        entity.direction = direction;
        entity.amount = draft.getAmount();
        entity.fee = draft.getFee();
        entity.tax = draft.getTax();
        entity.totalAmount = direction == TransactionDirection.DEBIT
                ? Math.addExact(Math.addExact(draft.getAmount(), draft.getFee()), draft.getTax())
                : draft.getAmount();
        entity.currency = draft.getCurrency();
        entity.status = draft.getInitialStatus();
        entity.senderDetails = draft.getSenderDetails();
        entity.receiverDetails = draft.getReceiverDetails();
        entity.balanceBefore = draft.getBalanceBefore();
        entity.balanceAfter = draft.getBalanceAfter();
        entity.balanceAffecting = draft.isBalanceAffecting();
        entity.paymentMethod = draft.getPaymentMethod();
        entity.paymentMethodDetails = draft.getPaymentMethodDetails();
        entity.externalReferenceId = draft.getExternalReferenceId();
        entity.description = draft.getDescription();
        entity.remarks = draft.getRemarks();
        entity.category = draft.getCategory();
        entity.metadata = draft.getMetadata() == null ? Collections.emptyMap() : new LinkedHashMap<>(draft.getMetadata());
        entity.createdAt = now;
        entity.initiatedAt = now;
        entity.updatedAt = now;
        if (draft.getInitialStatus() == TransactionStatus.COMPLETED) {
            entity.completedAt = now;
        }
        entity.statusHistory.add(StatusHistoryEntity.append(entity, 0, draft.getInitialStatus(),
                now, draft.getInitialReason(), draft.getActor()));
        return entity;
    }

    /**
     * Moves the entry to {@code target} and appends a history row.
     * Callers check {@link TransactionStatus#canTransitionTo} first.
     *
     * The history timestamp never goes backwards even if the clock does.
     */
    void applyStatus(TransactionStatus target, StatusUpdate update, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + target + " for " + transactionId);
        }
        StatusHistoryEntity last = statusHistory.get(statusHistory.size() - 1);
        Instant changedAt = now.isBefore(last.getChangedAt()) ? last.getChangedAt() : now;

        this.status = target;
        if (target == TransactionStatus.COMPLETED) {
            this.completedAt = changedAt;
        }
        if (update.getBalanceAfter() != null) {
            this.balanceAfter = update.getBalanceAfter();
        }
        if (update.getGatewayReference() != null) {
            this.gatewayReference = update.getGatewayReference();
        }
        if (update.getErrorDetails() != null) {
            this.errorDetails = update.getErrorDetails();
        }
        this.updatedAt = changedAt;
        statusHistory.add(StatusHistoryEntity.append(this, last.getSequenceNumber() + 1, target,
                changedAt, update.getReason(), update.getActor()));
    }

    public LedgerTransaction toDomain() {
        return LedgerTransaction.builder()
            .id(id)
            .transactionId(transactionId)
            .ownerUserId(ownerUserId)
            .type(type)
            .direction(direction)
            .amount(amount)
            .fee(fee)
            .tax(tax)
            .totalAmount(totalAmount)
            .currency(currency)
            .status(status)
            .statusHistory(statusHistory.stream().map(StatusHistoryEntity::toDomain).toList())
            .senderDetails(senderDetails)
            .receiverDetails(receiverDetails)
            .balanceBefore(balanceBefore)
            .balanceAfter(balanceAfter)
            .balanceAffecting(balanceAffecting)
            .paymentMethod(paymentMethod)
            .paymentMethodDetails(paymentMethodDetails)
            .externalReferenceId(externalReferenceId)
            .gatewayReference(gatewayReference)
            .description(description)
            .remarks(remarks)
            .category(category)
            .errorDetails(errorDetails)
            .metadata(metadata == null ? Collections.emptyMap() : metadata)
            .createdAt(createdAt)
            .initiatedAt(initiatedAt)
            .completedAt(completedAt)
            .updatedAt(updatedAt)
            .build();
    }
}
