package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.exception.CounterpartyNotFoundException;
import com.flagship.wallet_ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.exception.PersistenceException;
import com.flagship.wallet_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Balance accessor over {@code wallet_accounts}.
 *
 * Mutations for one user are serialised in-process by a lock stripe, and the
 * SQL update itself is conditional on the balance staying non-negative, so
 * two debits racing against one wallet can never both pass even across
 * service instances. Each adjustment commits on its own.
 */
@Service
@Slf4j
public class JpaBalanceAccessor implements BalanceAccessor {

    private static final int LOCK_STRIPES = 256;

    private final WalletAccountRepository repository;
    private final TransactionTemplate adjustTemplate;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public JpaBalanceAccessor(WalletAccountRepository repository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.repository = repository;
        this.adjustTemplate = new TransactionTemplate(transactionManager);
        this.adjustTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long getBalance(UUID userId) {
        return repository.findBalance(userId)
            .orElseThrow(() -> walletNotFound(userId));
    }

    @Override
    public long atomicAdjust(UUID userId, long delta) {
        if (delta == 0) {
            throw new ValidationException("Balance adjustment must be non-zero");
        }
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            Long newBalance = adjustTemplate.execute(status -> {
                int updated = repository.applyDelta(userId, delta, clock.instant());
                if (updated == 0) {
                    if (!repository.existsById(userId)) {
                        throw walletNotFound(userId);
                    }
                    throw new InsufficientFundsException(userId, -delta);
                }
                return repository.findBalance(userId).orElseThrow(() -> walletNotFound(userId));
            });
            log.debug("Balance adjusted: userId={}, delta={}, balance={}", userId, delta, newBalance);
            return newBalance;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to adjust balance for " + userId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public UUID findUserByEmailOrPhone(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException("Recipient identifier is required");
        }
        String trimmed = identifier.trim();
        return repository.findUserIdByIdentifier(trimmed, trimmed.toLowerCase(Locale.ROOT))
            .orElseThrow(() -> new CounterpartyNotFoundException("No wallet found for " + trimmed));
    }

    @Override
    @Transactional(readOnly = true)
    public WalletAccount getAccount(UUID userId) {
        return repository.findById(userId)
            .map(WalletAccountEntity::toDomain)
            .orElseThrow(() -> walletNotFound(userId));
    }

    private ReentrantLock lockFor(UUID userId) {
        return locks[Math.floorMod(userId.hashCode(), LOCK_STRIPES)];
    }

    private static CounterpartyNotFoundException walletNotFound(UUID userId) {
        return new CounterpartyNotFoundException("Wallet not found for user " + userId);
    }
}
