package com.flagship.wallet_ledger.verification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered biometric template, stored only as a SHA-256 hash.
 */
@Entity
@Table(name = "biometric_credentials")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BiometricCredentialEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private VerificationMethod method;

    @Column(name = "template_hash", nullable = false, length = 64)
    private String templateHash;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    static BiometricCredentialEntity register(UUID userId, VerificationMethod method,
                                              String templateHash, Instant now) {
        return new BiometricCredentialEntity(UUID.randomUUID(), userId, method, templateHash, true, now, null);
    }

    void markUsed(Instant at) {
        this.lastUsedAt = at;
    }

    void deactivate() {
        this.active = false;
    }
}
