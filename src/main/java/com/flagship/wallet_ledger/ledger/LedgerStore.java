package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.exception.InvalidOperationException;
import com.flagship.wallet_ledger.exception.PersistenceException;
import com.flagship.wallet_ledger.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.event.LedgerTransactionEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every money movement.
 *
 * No business policy lives here: the store validates shape, assigns
 * identifiers, keeps the status history append-only and answers queries.
 * {@link #updateStatus} is the only way an existing entry changes.
 *
 * Every transition into a terminal or hold status writes a
 * {@link LedgerTransactionEvent} to the outbox in the same database transaction.
 */
@Service
@Slf4j
public class LedgerStore {

    private final LedgerTransactionRepository repository;
    private final TransactionIdGenerator idGenerator;
    private final OutboxService outboxService;
    private final TransactionTemplate insertTemplate;
    private final Clock clock;
    private final int maxPageSize;
    private final int maxIdAttempts;

    public LedgerStore(LedgerTransactionRepository repository,
                       TransactionIdGenerator idGenerator,
                       OutboxService outboxService,
                       PlatformTransactionManager transactionManager,
                       Clock clock,
                       @Value("${ledger.statement.max-page-size:100}") int maxPageSize,
                       @Value("${ledger.transaction-id.max-attempts:5}") int maxIdAttempts) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.outboxService = outboxService;
        this.insertTemplate = new TransactionTemplate(transactionManager);
        this.insertTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.maxPageSize = maxPageSize;
        this.maxIdAttempts = maxIdAttempts;
    }

    /**
     * Persists a new entry.
     *
     * Each attempt runs in its own transaction. A collision on the generated
     * transaction ID is retried with a fresh suffix; a collision on the
     * external reference is reported as {@link DuplicateExternalReferenceException}.
     *
     * @throws ValidationException if type, amount, payment method, owner or direction is missing
     * @throws PersistenceException if the store is unavailable or every ID attempt collided
     */
    public LedgerTransaction create(TransactionDraft draft) {
        TransactionDirection direction = validate(draft);

        for (int attempt = 1; attempt <= maxIdAttempts; attempt++) {
            String transactionId = idGenerator.next();
            try {
                LedgerTransaction created = insertTemplate.execute(status -> insert(draft, transactionId, direction));
                log.info("Ledger entry created: transactionId={}, owner={}, type={}, direction={}, amount={}, status={}",
                        created.getTransactionId(), created.getOwnerUserId(), created.getType(),
                        created.getDirection(), created.getAmount(), created.getStatus());
                return created;
            } catch (DataIntegrityViolationException e) {
                if (draft.getExternalReferenceId() != null
                        && repository.existsByExternalReferenceId(draft.getExternalReferenceId())) {
                    throw new DuplicateExternalReferenceException(draft.getExternalReferenceId(), e);
                }
                if (!repository.existsByTransactionId(transactionId)) {
                    throw new PersistenceException("Failed to persist ledger entry", e);
                }
                log.warn("Transaction ID collision on {}, regenerating (attempt {}/{})",
                        transactionId, attempt, maxIdAttempts);
            } catch (DataAccessException e) {
                throw new PersistenceException("Failed to persist ledger entry", e);
            }
        }
        throw new PersistenceException("Could not allocate a unique transaction ID after " + maxIdAttempts + " attempts");
    }

    private LedgerTransaction insert(TransactionDraft draft, String transactionId, TransactionDirection direction) {
        TransactionEntity entity = TransactionEntity.create(draft, transactionId, direction, clock.instant());
        TransactionEntity saved = repository.saveAndFlush(entity);
        LedgerTransaction created = saved.toDomain();
        if (created.getStatus().isNotable()) {
            publish(created, draft.getInitialReason());
        }
        return created;
    }

    private TransactionDirection validate(TransactionDraft draft) {
        if (draft.getOwnerUserId() == null) {
            throw new ValidationException("Owner user ID is required");
        }
        if (draft.getType() == null) {
            throw new ValidationException("Transaction type is required");
        }
        if (draft.getAmount() == null) {
            throw new ValidationException("Amount is required");
        }
        if (draft.getPaymentMethod() == null) {
            throw new ValidationException("Payment method is required");
        }
        if (draft.getAmount() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (draft.getFee() < 0 || draft.getTax() < 0) {
            throw new ValidationException("Fee and tax cannot be negative");
        }
        if (draft.getInitialStatus() == null) {
            throw new ValidationException("Initial status is required");
        }
        if (draft.getDirection() != null) {
            return draft.getDirection();
        }
        return draft.getType().inferredDirection()
            .orElseThrow(() -> new ValidationException(
                "Direction must be given explicitly for type " + draft.getType()));
    }

    @Transactional(readOnly = true)
    public LedgerTransaction findById(UUID id) {
        return repository.findById(id)
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> new TransactionNotFoundException(id.toString()));
    }

    /**
     * Looks an entry up on behalf of {@code ownerUserId}. Entries of other
     * users are reported as not found.
     */
    @Transactional(readOnly = true)
    public LedgerTransaction findOwnedById(UUID ownerUserId, UUID id) {
        return repository.findById(id)
            .filter(entity -> entity.getOwnerUserId().equals(ownerUserId))
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> new TransactionNotFoundException(id.toString()));
    }

    @Transactional(readOnly = true)
    public LedgerTransaction findByTransactionId(String transactionId) {
        return repository.findByTransactionId(transactionId)
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    @Transactional(readOnly = true)
    public LedgerTransaction findOwnedByTransactionId(UUID ownerUserId, String transactionId) {
        return repository.findByTransactionId(transactionId)
            .filter(entity -> entity.getOwnerUserId().equals(ownerUserId))
            .map(TransactionEntity::toDomain)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findByExternalReferenceId(String externalReferenceId) {
        return repository.findByExternalReferenceId(externalReferenceId)
            .map(TransactionEntity::toDomain);
    }

    /**
     * Filtered, sorted, paginated statement for one owner.
     * The page size is capped at {@code ledger.statement.max-page-size}.
     */
    @Transactional(readOnly = true)
    public TransactionPage findByOwner(UUID ownerUserId, TransactionFilter filter) {
        if (filter.getPage() < 1) {
            throw new ValidationException("Page must be at least 1");
        }
        if (filter.getLimit() < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        int limit = Math.min(filter.getLimit(), maxPageSize);
        Sort sort = Sort.by(filter.getSortDirection(), filter.getSortBy().property())
            .and(Sort.by(Sort.Direction.DESC, "transactionId"));

        Page<TransactionEntity> page = repository.findAll(
            TransactionSpecifications.ownedBy(ownerUserId).and(TransactionSpecifications.matching(filter)),
            PageRequest.of(filter.getPage() - 1, limit, sort));

        List<LedgerTransaction> entries = page.getContent().stream()
            .map(TransactionEntity::toDomain)
            .toList();
        return new TransactionPage(entries, page.getTotalElements(), filter.getPage(), limit);
    }

    /**
     * Case-insensitive substring search over an owner's entries, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> search(UUID ownerUserId, String text, int limit) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Search query is required");
        }
        if (limit < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        PageRequest pageRequest = PageRequest.of(0, Math.min(limit, maxPageSize),
            Sort.by(Sort.Direction.DESC, "createdAt"));
        return repository.findAll(
                TransactionSpecifications.ownedBy(ownerUserId)
                    .and(TransactionSpecifications.containsText(text.trim())),
                pageRequest)
            .getContent().stream()
            .map(TransactionEntity::toDomain)
            .toList();
    }

    /**
     * Applies a status transition under a row lock and appends it to the history.
     *
     * @throws TransactionNotFoundException if the entry does not exist
     * @throws InvalidOperationException if the transition is not allowed from the current status
     */
    @Transactional
    public LedgerTransaction updateStatus(UUID id, TransactionStatus newStatus, StatusUpdate update) {
        TransactionEntity entity = repository.findByIdForUpdate(id)
            .orElseThrow(() -> new TransactionNotFoundException(id.toString()));

        TransactionStatus current = entity.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidOperationException(
                "Cannot move transaction " + entity.getTransactionId() + " from " + current + " to " + newStatus)
                .withTransactionId(entity.getTransactionId());
        }

        entity.applyStatus(newStatus, update, clock.instant());
        LedgerTransaction updated = repository.saveAndFlush(entity).toDomain();

        log.info("Ledger entry status changed: transactionId={}, {} -> {}, actor={}, reason={}",
                updated.getTransactionId(), current, newStatus, update.getActor(), update.getReason());

        if (newStatus.isNotable()) {
            publish(updated, update.getReason());
        }
        return updated;
    }

    /**
     * Irreversibly removes every entry owned by {@code ownerUserId}.
     *
     * @return number of entries removed
     */
    @Transactional
    public int deleteByOwner(UUID ownerUserId) {
        int history = repository.deleteHistoryByOwner(ownerUserId);
        int deleted = repository.deleteByOwner(ownerUserId);
        log.warn("Erased ledger for owner={}: entries={}, historyRows={}", ownerUserId, deleted, history);
        return deleted;
    }

    /**
     * Entries that have been {@code PROCESSING} for longer than {@code age}.
     */
    @Transactional(readOnly = true)
    public List<UUID> findStuckProcessing(Duration age, int limit) {
        Instant cutoff = clock.instant().minus(age);
        return repository.findIdsByStatusSince(TransactionStatus.PROCESSING, cutoff, PageRequest.of(0, limit));
    }

    private void publish(LedgerTransaction transaction, String reason) {
        LedgerTransactionEvent event = LedgerTransactionEvent.fromTransaction(transaction, reason, clock.instant());
        outboxService.saveEvent(LedgerTransactionEvent.AGGREGATE_TYPE, transaction.getId(),
                event.getEventType(), event);
    }
}
