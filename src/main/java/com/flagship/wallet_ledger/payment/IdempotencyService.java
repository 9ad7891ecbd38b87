package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.PersistenceException;
import com.flagship.wallet_ledger.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps external reference IDs (the {@code Idempotency-Key} header) to the
 * ledger entry they produced.
 *
 * Redis is the fast path when it is configured and reachable; the ledger's
 * own external-reference column is the source of truth and is always
 * consulted on a Redis miss or failure.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the ledger entry already recorded for {@code externalReferenceId}, if any
     */
    public Optional<LedgerTransaction> findExisting(String externalReferenceId) {
        if (externalReferenceId == null || externalReferenceId.isBlank()) {
            throw new IllegalArgumentException("External reference ID cannot be null or blank");
        }

        Optional<UUID> cached = lookupRedis(externalReferenceId);
        if (cached.isPresent()) {
            try {
                LedgerTransaction entry = ledgerStore.findById(cached.get());
                log.debug("Idempotency key found in Redis: {}", externalReferenceId);
                return Optional.of(entry);
            } catch (TransactionNotFoundException e) {
                log.debug("Stale idempotency mapping in Redis for {}", externalReferenceId);
            }
        }

        Optional<LedgerTransaction> existing;
        try {
            existing = ledgerStore.findByExternalReferenceId(externalReferenceId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to check idempotency key " + externalReferenceId, e);
        }
        existing.ifPresent(entry -> remember(externalReferenceId, entry.getId()));
        return existing;
    }

    /**
     * Caches the mapping in Redis. The database row already holds it.
     */
    public void remember(String externalReferenceId, UUID ledgerEntryId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + externalReferenceId, ledgerEntryId.toString(), REDIS_TTL);
            } catch (RuntimeException e) {
                log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", externalReferenceId, e.getMessage());
            }
        });
    }

    private Optional<UUID> lookupRedis(String externalReferenceId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + externalReferenceId);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                    externalReferenceId, e.getMessage());
            return Optional.empty();
        }
    }
}
