package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.ledger.TransactionEntity;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only aggregate queries over ledger entries. Both date bounds are inclusive.
 *
 * Grouped rows come back as {@code [key, count, sum(amount), sum(fee)]}.
 */
public interface AnalyticsRepository extends Repository<TransactionEntity, UUID> {

    @Query("""
        SELECT t.direction, COUNT(t), SUM(t.amount), SUM(t.fee)
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId AND t.status = :status
          AND t.createdAt >= :from AND t.createdAt <= :to
        GROUP BY t.direction
        """)
    List<Object[]> sumByDirection(@Param("ownerId") UUID ownerId,
                                  @Param("status") TransactionStatus status,
                                  @Param("from") Instant from,
                                  @Param("to") Instant to);

    @Query("""
        SELECT t.type, COUNT(t), SUM(t.amount), SUM(t.fee)
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId AND t.status = :status
          AND t.createdAt >= :from AND t.createdAt <= :to
        GROUP BY t.type
        """)
    List<Object[]> sumByType(@Param("ownerId") UUID ownerId,
                             @Param("status") TransactionStatus status,
                             @Param("from") Instant from,
                             @Param("to") Instant to);

    @Query("""
        SELECT t.paymentMethod, COUNT(t), SUM(t.amount), SUM(t.fee)
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId AND t.status = :status
          AND t.createdAt >= :from AND t.createdAt <= :to
        GROUP BY t.paymentMethod
        """)
    List<Object[]> sumByPaymentMethod(@Param("ownerId") UUID ownerId,
                                      @Param("status") TransactionStatus status,
                                      @Param("from") Instant from,
                                      @Param("to") Instant to);

    @Query("""
        SELECT t.status, COUNT(t), SUM(t.amount), SUM(t.fee)
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId
          AND t.createdAt >= :from AND t.createdAt <= :to
        GROUP BY t.status
        """)
    List<Object[]> sumByStatus(@Param("ownerId") UUID ownerId,
                               @Param("from") Instant from,
                               @Param("to") Instant to);

    /**
     * Rows of {@code [createdAt, direction, type, amount]}, oldest first.
     */
    @Query("""
        SELECT t.createdAt, t.direction, t.type, t.amount
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId AND t.status = :status
          AND t.createdAt >= :from AND t.createdAt <= :to
        ORDER BY t.createdAt ASC
        """)
    List<Object[]> findActivity(@Param("ownerId") UUID ownerId,
                                @Param("status") TransactionStatus status,
                                @Param("from") Instant from,
                                @Param("to") Instant to);

    /**
     * {@code [direction, sum(totalAmount)]} over entries that moved the wallet balance.
     */
    @Query("""
        SELECT t.direction, SUM(t.totalAmount)
        FROM TransactionEntity t
        WHERE t.ownerUserId = :ownerId AND t.status = :status AND t.balanceAffecting = true
        GROUP BY t.direction
        """)
    List<Object[]> sumBalanceAffectingTotals(@Param("ownerId") UUID ownerId,
                                             @Param("status") TransactionStatus status);
}
