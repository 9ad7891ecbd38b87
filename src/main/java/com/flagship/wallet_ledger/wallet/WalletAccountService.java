package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.exception.CounterpartyNotFoundException;
import com.flagship.wallet_ledger.exception.InvalidOperationException;
import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Wallet lifecycle: provisioning for the onboarding layer, and erasure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletAccountService {

    private static final int MIN_PIN_LENGTH = 4;

    private final WalletAccountRepository repository;
    private final LedgerStore ledgerStore;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional
    public WalletAccount openWallet(OpenWalletCommand command) {
        if (command.getDisplayName() == null || command.getDisplayName().isBlank()) {
            throw new ValidationException("Display name is required");
        }
        if (command.getEmail() == null && command.getPhone() == null) {
            throw new ValidationException("E-mail or phone is required");
        }
        if (command.getOpeningBalance() < 0) {
            throw new ValidationException("Opening balance cannot be negative");
        }
        if (command.getPin() != null && (command.getPin().length() < MIN_PIN_LENGTH || !command.getPin().chars().allMatch(Character::isDigit))) {
            throw new ValidationException("PIN must be at least " + MIN_PIN_LENGTH + " digits");
        }

        UUID userId = command.getUserId() != null ? command.getUserId() : UUID.randomUUID();
        if (repository.existsById(userId)) {
            throw new InvalidOperationException("Wallet already exists for user " + userId);
        }
        WalletAccountEntity entity = WalletAccountEntity.open(
            userId,
            command.getDisplayName().trim(),
            command.getEmail() == null ? null : command.getEmail().trim().toLowerCase(Locale.ROOT),
            command.getPhone() == null ? null : command.getPhone().trim(),
            command.getUpiId() == null ? null : command.getUpiId().trim().toLowerCase(Locale.ROOT),
            command.getOpeningBalance(),
            command.getPin() == null ? null : passwordEncoder.encode(command.getPin()),
            clock.instant());
        try {
            WalletAccount account = repository.saveAndFlush(entity).toDomain();
            log.info("Wallet opened: userId={}, openingBalance={}", userId, command.getOpeningBalance());
            return account;
        } catch (DataIntegrityViolationException e) {
            throw new InvalidOperationException("Wallet identifiers already in use");
        }
    }

    /**
     * Deletes the wallet and every ledger entry it owns. Irreversible.
     * Biometric credentials go with the wallet row.
     */
    @Transactional
    public void eraseAccount(UUID userId) {
        if (!repository.existsById(userId)) {
            throw new CounterpartyNotFoundException("Wallet not found for user " + userId);
        }
        int entries = ledgerStore.deleteByOwner(userId);
        repository.deleteByUserId(userId);
        log.warn("Wallet erased: userId={}, ledgerEntries={}", userId, entries);
    }
}
