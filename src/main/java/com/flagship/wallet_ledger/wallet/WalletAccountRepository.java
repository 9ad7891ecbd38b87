package com.flagship.wallet_ledger.wallet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletAccountRepository extends JpaRepository<WalletAccountEntity, UUID> {

    /**
     * Adds {@code delta} to the balance unless the result would be negative.
     *
     * @return 1 if applied, 0 if the wallet is missing or the balance is short
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WalletAccountEntity w
        SET w.balance = w.balance + :delta, w.updatedAt = :now
        WHERE w.userId = :userId AND w.balance + :delta >= 0
        """)
    int applyDelta(@Param("userId") UUID userId, @Param("delta") long delta, @Param("now") Instant now);

    @Query("SELECT w.balance FROM WalletAccountEntity w WHERE w.userId = :userId")
    Optional<Long> findBalance(@Param("userId") UUID userId);

    /**
     * Matches an e-mail or UPI address case-insensitively, or a phone number exactly.
     */
    @Query("""
        SELECT w.userId FROM WalletAccountEntity w
        WHERE LOWER(w.email) = :lowered OR LOWER(w.upiId) = :lowered OR w.phone = :identifier
        """)
    Optional<UUID> findUserIdByIdentifier(@Param("identifier") String identifier, @Param("lowered") String lowered);

    @Query("SELECT w.pinHash FROM WalletAccountEntity w WHERE w.userId = :userId")
    Optional<String> findPinHash(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM WalletAccountEntity w WHERE w.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);
}
