package com.flagship.wallet_ledger.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's wallet. The balance column is only ever changed by the
 * conditional update in {@link WalletAccountRepository#applyDelta}.
 */
@Entity
@Table(name = "wallet_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WalletAccountEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(unique = true, length = 320)
    private String email;

    @Column(unique = true, length = 32)
    private String phone;

    @Column(name = "upi_id", unique = true, length = 100)
    private String upiId;

    @Column(nullable = false)
    private long balance;

    @Column(name = "opening_balance", nullable = false, updatable = false)
    private long openingBalance;

    @Column(name = "pin_hash", length = 100)
    private String pinHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static WalletAccountEntity open(UUID userId, String displayName, String email, String phone,
                                    String upiId, long openingBalance, String pinHash, Instant now) {
        return new WalletAccountEntity(userId, displayName, email, phone, upiId,
                openingBalance, openingBalance, pinHash, now, now);
    }

    WalletAccount toDomain() {
        return new WalletAccount(userId, displayName, email, phone, upiId, balance, openingBalance, createdAt);
    }
}
