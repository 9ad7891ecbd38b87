package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository
        extends JpaRepository<TransactionEntity, UUID>, JpaSpecificationExecutor<TransactionEntity> {

    Optional<TransactionEntity> findByTransactionId(String transactionId);

    Optional<TransactionEntity> findByExternalReferenceId(String externalReferenceId);

    boolean existsByTransactionId(String transactionId);

    boolean existsByExternalReferenceId(String externalReferenceId);

    /**
     * Loads an entry with a row lock so concurrent status transitions on it
     * are applied one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionEntity t WHERE t.id = :id")
    Optional<TransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * IDs of entries sitting in {@code status} since before {@code cutoff}, oldest first.
     */
    @Query("""
        SELECT t.id FROM TransactionEntity t
        WHERE t.status = :status AND t.updatedAt < :cutoff
        ORDER BY t.updatedAt ASC
        """)
    List<UUID> findIdsByStatusSince(@Param("status") TransactionStatus status,
                                    @Param("cutoff") Instant cutoff,
                                    Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("""
        DELETE FROM StatusHistoryEntity h
        WHERE h.transaction.id IN (SELECT t.id FROM TransactionEntity t WHERE t.ownerUserId = :ownerId)
        """)
    int deleteHistoryByOwner(@Param("ownerId") UUID ownerId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM TransactionEntity t WHERE t.ownerUserId = :ownerId")
    int deleteByOwner(@Param("ownerId") UUID ownerId);

    long countByOwnerUserId(UUID ownerUserId);
}
