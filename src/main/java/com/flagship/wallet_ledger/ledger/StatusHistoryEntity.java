package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of the append-only status history. Rows are inserted, never updated.
 */
@Entity
@Table(name = "transaction_status_history")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusHistoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_id", nullable = false, updatable = false)
    private TransactionEntity transaction;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionStatus status;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    @Column(updatable = false, length = 1000)
    private String reason;

    @Column(nullable = false, updatable = false, length = 100)
    private String actor;

    static StatusHistoryEntity append(TransactionEntity transaction, int sequenceNumber,
                                      TransactionStatus status, Instant changedAt,
                                      String reason, String actor) {
        return new StatusHistoryEntity(UUID.randomUUID(), transaction, sequenceNumber,
                status, changedAt, reason, actor);
    }

    StatusHistoryEntry toDomain() {
        return new StatusHistoryEntry(status, changedAt, reason, actor);
    }
}
