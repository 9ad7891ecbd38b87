package com.flagship.wallet_ledger.verification;

import com.flagship.wallet_ledger.wallet.WalletAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Verification against stored credentials: the wallet's BCrypt PIN hash, or
 * an active biometric template registered for the same modality.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialVerificationGate implements VerificationGate {

    private final WalletAccountRepository walletAccountRepository;
    private final BiometricCredentialRepository biometricCredentialRepository;
    private final PasswordEncoder pinEncoder;
    private final Clock clock;

    @Override
    @Transactional
    public boolean verify(UUID userId, VerificationMethod method, String proof) {
        if (userId == null || method == null || proof == null || proof.isEmpty()) {
            return false;
        }
        boolean verified = method == VerificationMethod.PIN
                ? verifyPin(userId, proof)
                : verifyBiometric(userId, method, proof);
        if (!verified) {
            log.warn("Verification failed: userId={}, method={}", userId, method);
        }
        return verified;
    }

    private boolean verifyPin(UUID userId, String pin) {
        Optional<String> pinHash = walletAccountRepository.findPinHash(userId);
        return pinHash.isPresent() && pinEncoder.matches(pin, pinHash.get());
    }

    private boolean verifyBiometric(UUID userId, VerificationMethod method, String template) {
        Optional<BiometricCredentialEntity> match = biometricCredentialRepository
            .findByUserIdAndMethodAndActiveTrue(userId, method).stream()
            .filter(credential -> TemplateHasher.matches(template, credential.getTemplateHash()))
            .findFirst();
        match.ifPresent(credential -> credential.markUsed(clock.instant()));
        return match.isPresent();
    }
}
