package com.flagship.wallet_ledger.verification;

import com.flagship.wallet_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Registration side of biometric verification. Capture itself happens on
 * the device; only the resulting template reaches this service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BiometricCredentialService {

    private final BiometricCredentialRepository repository;
    private final Clock clock;

    @Transactional
    public UUID register(UUID userId, VerificationMethod method, String template) {
        if (method == null || !method.isBiometric()) {
            throw new ValidationException("A biometric method is required");
        }
        if (template == null || template.isBlank()) {
            throw new ValidationException("Biometric template is required");
        }
        BiometricCredentialEntity saved = repository.save(
            BiometricCredentialEntity.register(userId, method, TemplateHasher.sha256Hex(template), clock.instant()));
        log.info("Biometric credential registered: userId={}, method={}", userId, method);
        return saved.getId();
    }

    /**
     * @return number of credentials deactivated
     */
    @Transactional
    public int deactivate(UUID userId, VerificationMethod method) {
        var credentials = repository.findByUserIdAndMethod(userId, method);
        credentials.forEach(BiometricCredentialEntity::deactivate);
        log.info("Biometric credentials deactivated: userId={}, method={}, count={}", userId, method, credentials.size());
        return credentials.size();
    }
}
