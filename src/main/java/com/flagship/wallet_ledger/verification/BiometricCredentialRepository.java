package com.flagship.wallet_ledger.verification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BiometricCredentialRepository extends JpaRepository<BiometricCredentialEntity, UUID> {

    List<BiometricCredentialEntity> findByUserIdAndMethodAndActiveTrue(UUID userId, VerificationMethod method);

    List<BiometricCredentialEntity> findByUserIdAndMethod(UUID userId, VerificationMethod method);
}
