package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.AuthenticationException;
import com.flagship.wallet_ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.exception.InvalidOperationException;
import com.flagship.wallet_ledger.exception.LedgerException;
import com.flagship.wallet_ledger.exception.PaymentProcessingException;
import com.flagship.wallet_ledger.exception.PersistenceException;
import com.flagship.wallet_ledger.exception.SettlementFailedException;
import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.DuplicateExternalReferenceException;
import com.flagship.wallet_ledger.ledger.ErrorDetails;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.PaymentMethodDetails;
import com.flagship.wallet_ledger.ledger.StatusUpdate;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionDraft;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.verification.VerificationGate;
import com.flagship.wallet_ledger.verification.VerificationMethod;
import com.flagship.wallet_ledger.wallet.BalanceAccessor;
import com.flagship.wallet_ledger.wallet.WalletAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates every money movement against the ledger and the wallets.
 *
 * Steps, in order:
 * 1. Validate input (nothing written on failure)
 * 2. Verify the PIN or biometric proof (nothing written on failure)
 * 3. Resolve the recipient for transfers
 * 4. Replay the recorded entry when the external reference was seen before
 * 5. Check funds against the live balance (nothing written on failure)
 * 6. Record the payer's entry as PROCESSING
 * 7. Settle through the gateway where the use case needs it
 * 8. Move the money through the balance accessor, plus the receiver leg for transfers
 * 9. Complete the payer's entry
 *
 * A failure after step 6 reverses whatever balance adjustments were applied,
 * voids an approved gateway settlement and marks the entry FAILED. If any
 * reversal or void fails the entry goes ON_HOLD for manual reconciliation
 * instead. The gateway reference stays on the entry either way.
 *
 * The two legs of a transfer live in separate database transactions; their
 * consistency is kept by compensation rather than a shared commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentProcessor {

    private final LedgerStore ledgerStore;
    private final BalanceAccessor balanceAccessor;
    private final VerificationGate verificationGate;
    private final SettlementGateway settlementGateway;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    /**
     * Runs a non-transfer use case for {@code ownerId}.
     *
     * @return the owner's ledger entry, completed (or the previously recorded
     *         entry when the external reference is a replay)
     */
    public LedgerTransaction processPayment(UUID ownerId, PaymentCommand command) {
        long started = System.nanoTime();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, ownerId.toString());
        try {
            validate(command);
            authorise(ownerId, command.getPaymentType(), command.getAuthProof());

            Optional<LedgerTransaction> replay = replay(ownerId, command.getExternalReferenceId());
            if (replay.isPresent()) {
                return replay.get();
            }

            PaymentType paymentType = command.getPaymentType();
            WalletAccount payer = balanceAccessor.getAccount(ownerId);
            TransactionDirection direction = paymentType.transactionType().inferredDirection()
                .orElseThrow(() -> new ValidationException("No direction for " + paymentType));
            long total = direction == TransactionDirection.DEBIT
                ? Math.addExact(Math.addExact(command.getAmount(), command.getFee()), command.getTax())
                : command.getAmount();
            if (paymentType.isBalanceAffecting() && direction == TransactionDirection.DEBIT && payer.getBalance() < total) {
                metrics.recordPayment(paymentType.name(), "insufficient_funds");
                throw new InsufficientFundsException(ownerId, total);
            }

            Optional<LedgerTransaction> created = record(paymentDraft(ownerId, payer, command));
            if (created.isEmpty()) {
                return idempotencyWinner(ownerId, command.getExternalReferenceId());
            }
            LedgerTransaction entry = created.get();
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, entry.getTransactionId());

            List<Adjustment> applied = new ArrayList<>();
            String gatewayReference = null;
            try {
                if (paymentType.isGatewaySettled()) {
                    gatewayReference = settle(entry, paymentType);
                }
                long balanceAfter = payer.getBalance();
                if (paymentType.isBalanceAffecting()) {
                    long delta = direction == TransactionDirection.DEBIT ? -total : total;
                    balanceAfter = balanceAccessor.atomicAdjust(ownerId, delta);
                    applied.add(new Adjustment(ownerId, delta));
                }
                LedgerTransaction completed = ledgerStore.updateStatus(entry.getId(), TransactionStatus.COMPLETED,
                    StatusUpdate.builder()
                        .reason(describe(paymentType) + " completed")
                        .actor(actorFor(ownerId))
                        .balanceAfter(balanceAfter)
                        .gatewayReference(gatewayReference)
                        .build());
                metrics.recordPayment(paymentType.name(), "completed");
                log.info("Payment completed: transactionId={}, type={}, amount={}, balanceAfter={}",
                        completed.getTransactionId(), paymentType, completed.getAmount(), balanceAfter);
                return completed;
            } catch (RuntimeException e) {
                throw fail(entry, paymentType, e, applied, null, gatewayReference);
            }
        } finally {
            metrics.recordLatency(command.getPaymentType() == null ? "unknown" : command.getPaymentType().name(),
                    Duration.ofNanos(System.nanoTime() - started));
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Moves money from {@code senderId} to the wallet named by the command.
     * Both legs are recorded: a debit entry for the sender and a completed
     * credit entry for the receiver.
     *
     * @return the sender's ledger entry
     */
    public LedgerTransaction processTransfer(UUID senderId, TransferCommand command) {
        long started = System.nanoTime();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, senderId.toString());
        try {
            validate(command);
            authorise(senderId, PaymentType.TRANSFER, command.getAuthProof());

            UUID recipientId = balanceAccessor.findUserByEmailOrPhone(command.getRecipientIdentifier());
            if (recipientId.equals(senderId)) {
                throw new InvalidOperationException("Cannot transfer to yourself");
            }

            Optional<LedgerTransaction> replay = replay(senderId, command.getExternalReferenceId());
            if (replay.isPresent()) {
                return replay.get();
            }

            long amount = command.getAmount();
            WalletAccount sender = balanceAccessor.getAccount(senderId);
            WalletAccount receiver = balanceAccessor.getAccount(recipientId);
            if (sender.getBalance() < amount) {
                metrics.recordPayment(PaymentType.TRANSFER.name(), "insufficient_funds");
                throw new InsufficientFundsException(senderId, amount);
            }

            Optional<LedgerTransaction> created = record(senderLegDraft(sender, receiver, command));
            if (created.isEmpty()) {
                return idempotencyWinner(senderId, command.getExternalReferenceId());
            }
            LedgerTransaction senderEntry = created.get();
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, senderEntry.getTransactionId());

            List<Adjustment> applied = new ArrayList<>();
            LedgerTransaction receiverEntry = null;
            try {
                long senderBalance = balanceAccessor.atomicAdjust(senderId, -amount);
                applied.add(new Adjustment(senderId, -amount));
                long receiverBalance = balanceAccessor.atomicAdjust(recipientId, amount);
                applied.add(new Adjustment(recipientId, amount));

                receiverEntry = ledgerStore.create(receiverLegDraft(sender, receiver, command,
                        senderEntry.getTransactionId(), receiverBalance));

                LedgerTransaction completed = ledgerStore.updateStatus(senderEntry.getId(), TransactionStatus.COMPLETED,
                    StatusUpdate.builder()
                        .reason("Transfer completed")
                        .actor(actorFor(senderId))
                        .balanceAfter(senderBalance)
                        .build());
                metrics.recordPayment(PaymentType.TRANSFER.name(), "completed");
                log.info("Transfer completed: transactionId={}, receiverTransactionId={}, amount={}, receiver={}",
                        completed.getTransactionId(), receiverEntry.getTransactionId(), amount, recipientId);
                return completed;
            } catch (RuntimeException e) {
                throw fail(senderEntry, PaymentType.TRANSFER, e, applied, receiverEntry, null);
            }
        } finally {
            metrics.recordLatency(PaymentType.TRANSFER.name(), Duration.ofNanos(System.nanoTime() - started));
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private void validate(PaymentCommand command) {
        PaymentType type = command.getPaymentType();
        if (type == null) {
            throw new ValidationException("Payment type is required");
        }
        if (type == PaymentType.TRANSFER) {
            throw new ValidationException("Transfers must be submitted as transfers");
        }
        validateAmount(command.getAmount());
        if (command.getFee() < 0 || command.getTax() < 0) {
            throw new ValidationException("Fee and tax cannot be negative");
        }
        if (type.isAuthorisationRequired() && (command.getAuthProof() == null || !command.getAuthProof().isPresent())) {
            throw new ValidationException("PIN or biometric proof is required");
        }
        PartyDetails counterpart = command.getCounterpart();
        switch (type) {
            case UPI -> {
                if (counterpart == null || isBlank(counterpart.getUpiId())) {
                    throw new ValidationException("Recipient UPI id is required");
                }
            }
            case BIOMETRIC -> {
                if (!command.getAuthProof().getMethod().isBiometric()) {
                    throw new ValidationException("Biometric payments need a biometric proof");
                }
                if (counterpart == null || (isBlank(counterpart.getUpiId()) && isBlank(counterpart.getName()))) {
                    throw new ValidationException("Recipient is required");
                }
            }
            case RECHARGE, BILL -> {
                if (counterpart == null || (isBlank(counterpart.getName()) && isBlank(counterpart.getPhone())
                        && isBlank(counterpart.getAccountNumber()))) {
                    throw new ValidationException("Operator or biller details are required");
                }
            }
            case CARD -> {
                if (command.getPaymentMethodDetails() == null || isBlank(command.getPaymentMethodDetails().getCardLast4())) {
                    throw new ValidationException("Card details are required");
                }
                if (counterpart == null || isBlank(counterpart.getName())) {
                    throw new ValidationException("Merchant is required");
                }
            }
            default -> {
            }
        }
    }

    private void validate(TransferCommand command) {
        validateAmount(command.getAmount());
        if (isBlank(command.getRecipientIdentifier())) {
            throw new ValidationException("Recipient e-mail, phone or UPI id is required");
        }
        if (command.getAuthProof() == null || !command.getAuthProof().isPresent()) {
            throw new ValidationException("PIN or biometric proof is required");
        }
    }

    private void validateAmount(Long amount) {
        if (amount == null) {
            throw new ValidationException("Amount is required");
        }
        if (amount <= 0) {
            throw new ValidationException("Amount must be positive");
        }
    }

    private void authorise(UUID userId, PaymentType type, AuthProof proof) {
        if (proof == null || !proof.isPresent()) {
            return;
        }
        if (!verificationGate.verify(userId, proof.getMethod(), proof.getProof())) {
            metrics.recordPayment(type.name(), "authentication_failed");
            throw new AuthenticationException(proof.getMethod() == VerificationMethod.PIN
                    ? "Invalid PIN"
                    : "Biometric verification failed");
        }
    }

    private Optional<LedgerTransaction> replay(UUID ownerId, String externalReferenceId) {
        String reference = blankToNull(externalReferenceId);
        if (reference == null) {
            return Optional.empty();
        }
        Optional<LedgerTransaction> existing = idempotencyService.findExisting(reference);
        if (existing.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        metrics.recordIdempotencyHit();
        LedgerTransaction entry = existing.get();
        if (!entry.isOwnedBy(ownerId)) {
            throw new InvalidOperationException("Idempotency key already used by another wallet");
        }
        log.info("Duplicate request replayed: externalReferenceId={}, transactionId={}, status={}",
                reference, entry.getTransactionId(), entry.getStatus());
        return Optional.of(entry);
    }

    /**
     * Creates the payer's entry. Empty when a concurrent request with the same
     * external reference got there first.
     */
    private Optional<LedgerTransaction> record(TransactionDraft draft) {
        try {
            LedgerTransaction entry = ledgerStore.create(draft);
            if (draft.getExternalReferenceId() != null) {
                idempotencyService.remember(draft.getExternalReferenceId(), entry.getId());
            }
            return Optional.of(entry);
        } catch (DuplicateExternalReferenceException e) {
            log.info("Lost idempotency race: externalReferenceId={}", e.getExternalReferenceId());
            return Optional.empty();
        }
    }

    private LedgerTransaction idempotencyWinner(UUID ownerId, String externalReferenceId) {
        return replay(ownerId, externalReferenceId)
            .orElseThrow(() -> new PersistenceException("Entry for " + externalReferenceId + " vanished"));
    }

    private String settle(LedgerTransaction entry, PaymentType paymentType) {
        SettlementGateway.SettlementResult result = settlementGateway.settle(settlementRequest(entry, paymentType));
        if (!result.isApproved()) {
            throw new SettlementFailedException(result.getDeclineReason());
        }
        return result.getReference();
    }

    private static SettlementGateway.SettlementRequest settlementRequest(LedgerTransaction entry, PaymentType paymentType) {
        return new SettlementGateway.SettlementRequest(
                entry.getId(), entry.getTransactionId(), paymentType, entry.getTotalAmount(), entry.getCurrency());
    }

    /**
     * Reverses applied adjustments and voids an approved settlement, records
     * the outcome on the payer's entry and returns the error to report.
     * A receiver leg is marked REFUNDED as soon as its own credit was taken back.
     */
    private LedgerException fail(LedgerTransaction entry, PaymentType paymentType, RuntimeException cause,
                                 List<Adjustment> applied, LedgerTransaction receiverEntry, String gatewayReference) {
        LedgerException error = translate(cause);
        error.withTransactionId(entry.getTransactionId());

        List<Adjustment> reversed = compensate(entry, applied);
        boolean settlementVoided = gatewayReference == null || voidSettlement(entry, paymentType, gatewayReference);
        boolean compensated = reversed.size() == applied.size() && settlementVoided;
        if (receiverEntry != null && reversed.stream().anyMatch(a -> a.userId().equals(receiverEntry.getOwnerUserId()))) {
            reverseReceiverLeg(receiverEntry, entry, error);
        }

        TransactionStatus target = compensated ? TransactionStatus.FAILED : TransactionStatus.ON_HOLD;
        ErrorDetails details = new ErrorDetails(error.getCode(), error.getMessage(), compensated && error.isRetryable());
        try {
            ledgerStore.updateStatus(entry.getId(), target, StatusUpdate.builder()
                .reason(compensated ? error.getMessage() : "Compensation failed: " + error.getMessage())
                .actor("system")
                .gatewayReference(gatewayReference)
                .errorDetails(details)
                .build());
        } catch (RuntimeException statusError) {
            log.error("Could not record {} on transactionId={}; left for the sweeper", target, entry.getTransactionId(), statusError);
            error.addSuppressed(statusError);
        }

        metrics.recordPayment(paymentType.name(), target.name());
        if (compensated) {
            log.warn("Payment failed: transactionId={}, type={}, code={}, message={}",
                    entry.getTransactionId(), paymentType, error.getCode(), error.getMessage());
        } else {
            log.error("Payment on hold after failed compensation: transactionId={}, type={}, code={}",
                    entry.getTransactionId(), paymentType, error.getCode(), cause);
        }
        return error;
    }

    /**
     * Reverses {@code applied} newest first.
     *
     * @return the adjustments that were actually reversed
     */
    private List<Adjustment> compensate(LedgerTransaction entry, List<Adjustment> applied) {
        List<Adjustment> reversed = new ArrayList<>();
        for (int i = applied.size() - 1; i >= 0; i--) {
            Adjustment adjustment = applied.get(i);
            try {
                balanceAccessor.atomicAdjust(adjustment.userId(), -adjustment.delta());
                reversed.add(adjustment);
                metrics.recordCompensation(true);
                log.info("Compensated adjustment: transactionId={}, userId={}, delta={}",
                        entry.getTransactionId(), adjustment.userId(), -adjustment.delta());
            } catch (RuntimeException e) {
                metrics.recordCompensation(false);
                log.error("Compensation failed: transactionId={}, userId={}, delta={}",
                        entry.getTransactionId(), adjustment.userId(), -adjustment.delta(), e);
            }
        }
        return reversed;
    }

    private boolean voidSettlement(LedgerTransaction entry, PaymentType paymentType, String gatewayReference) {
        boolean voided;
        try {
            voided = settlementGateway.voidSettlement(settlementRequest(entry, paymentType), gatewayReference);
        } catch (RuntimeException e) {
            metrics.recordCompensation(false);
            log.error("Settlement void failed: transactionId={}, gatewayReference={}",
                    entry.getTransactionId(), gatewayReference, e);
            return false;
        }
        metrics.recordCompensation(voided);
        if (voided) {
            log.info("Settlement voided: transactionId={}, gatewayReference={}", entry.getTransactionId(), gatewayReference);
        } else {
            log.error("Gateway refused to void settlement: transactionId={}, gatewayReference={}",
                    entry.getTransactionId(), gatewayReference);
        }
        return voided;
    }

    private void reverseReceiverLeg(LedgerTransaction receiverEntry, LedgerTransaction senderEntry, LedgerException error) {
        try {
            ledgerStore.updateStatus(receiverEntry.getId(), TransactionStatus.REFUNDED,
                StatusUpdate.of("Transfer " + senderEntry.getTransactionId() + " reversed", "system"));
        } catch (RuntimeException e) {
            log.error("Could not mark receiver leg reversed: transactionId={}", receiverEntry.getTransactionId(), e);
            error.addSuppressed(e);
        }
    }

    private LedgerException translate(RuntimeException cause) {
        if (cause instanceof LedgerException) {
            return (LedgerException) cause;
        }
        if (cause instanceof DataAccessException) {
            return new PersistenceException("Ledger storage failure: " + cause.getMessage(), cause);
        }
        return new PaymentProcessingException("Payment processing failed", cause);
    }

    private TransactionDraft paymentDraft(UUID ownerId, WalletAccount payer, PaymentCommand command) {
        PaymentType paymentType = command.getPaymentType();
        boolean credit = paymentType.transactionType() == TransactionType.ADD_MONEY;
        PaymentMethod method = command.getPaymentMethod() != null ? command.getPaymentMethod() : paymentType.defaultMethod();
        return TransactionDraft.builder()
            .ownerUserId(ownerId)
            .type(paymentType.transactionType())
            .amount(command.getAmount())
            .fee(command.getFee())
            .tax(command.getTax())
            .initialStatus(TransactionStatus.PROCESSING)
            .initialReason(describe(paymentType) + " initiated")
            .actor(actorFor(ownerId))
            .senderDetails(credit ? command.getCounterpart() : payer.toPartyDetails())
            .receiverDetails(credit ? payer.toPartyDetails() : command.getCounterpart())
            .balanceBefore(payer.getBalance())
            .balanceAffecting(paymentType.isBalanceAffecting())
            .paymentMethod(method)
            .paymentMethodDetails(methodDetailsFor(command))
            .externalReferenceId(blankToNull(command.getExternalReferenceId()))
            .description(command.getDescription() != null ? command.getDescription() : defaultDescription(command))
            .remarks(command.getRemarks())
            .category(command.getCategory() != null ? command.getCategory() : paymentType.name().toLowerCase(Locale.ROOT))
            .metadata(metadataFor(command.getMetadata(), command.getAuthProof()))
            .build();
    }

    private TransactionDraft senderLegDraft(WalletAccount sender, WalletAccount receiver, TransferCommand command) {
        Map<String, String> metadata = metadataFor(null, command.getAuthProof());
        metadata.put("receiverUserId", receiver.getUserId().toString());
        if (!isBlank(command.getNote())) {
            metadata.put("note", command.getNote());
        }
        return TransactionDraft.builder()
            .ownerUserId(sender.getUserId())
            .type(TransactionType.TRANSFER)
            .direction(TransactionDirection.DEBIT)
            .amount(command.getAmount())
            .initialStatus(TransactionStatus.PROCESSING)
            .initialReason("Transfer initiated")
            .actor(actorFor(sender.getUserId()))
            .senderDetails(sender.toPartyDetails())
            .receiverDetails(receiver.toPartyDetails())
            .balanceBefore(sender.getBalance())
            .paymentMethod(PaymentMethod.WALLET)
            .externalReferenceId(blankToNull(command.getExternalReferenceId()))
            .description("Transfer to " + receiver.getDisplayName())
            .remarks(command.getNote())
            .category("transfer")
            .metadata(metadata)
            .build();
    }

    private TransactionDraft receiverLegDraft(WalletAccount sender, WalletAccount receiver, TransferCommand command,
                                              String senderTransactionId, long receiverBalance) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("counterpartTransactionId", senderTransactionId);
        metadata.put("senderUserId", sender.getUserId().toString());
        if (!isBlank(command.getNote())) {
            metadata.put("note", command.getNote());
        }
        return TransactionDraft.builder()
            .ownerUserId(receiver.getUserId())
            .type(TransactionType.TRANSFER)
            .direction(TransactionDirection.CREDIT)
            .amount(command.getAmount())
            .initialStatus(TransactionStatus.COMPLETED)
            .initialReason("Transfer received")
            .actor(actorFor(sender.getUserId()))
            .senderDetails(sender.toPartyDetails())
            .receiverDetails(receiver.toPartyDetails())
            .balanceBefore(receiverBalance - command.getAmount())
            .balanceAfter(receiverBalance)
            .paymentMethod(PaymentMethod.WALLET)
            .description("Transfer from " + sender.getDisplayName())
            .remarks(command.getNote())
            .category("transfer")
            .metadata(metadata)
            .build();
    }

    private PaymentMethodDetails methodDetailsFor(PaymentCommand command) {
        if (command.getPaymentType() != PaymentType.BIOMETRIC || command.getPaymentMethodDetails() != null) {
            return command.getPaymentMethodDetails();
        }
        return PaymentMethodDetails.builder()
            .biometricType(command.getAuthProof().getMethod().name())
            .build();
    }

    private Map<String, String> metadataFor(Map<String, String> supplied, AuthProof authProof) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (supplied != null) {
            supplied.forEach((key, value) -> {
                if (key != null && value != null) {
                    metadata.put(key, value);
                }
            });
        }
        if (authProof != null && authProof.getMethod() != null) {
            metadata.put("authMethod", authProof.getMethod().name());
        }
        return metadata;
    }

    private String defaultDescription(PaymentCommand command) {
        PartyDetails counterpart = command.getCounterpart();
        String name = counterpart == null ? null
            : !isBlank(counterpart.getName()) ? counterpart.getName()
            : !isBlank(counterpart.getUpiId()) ? counterpart.getUpiId()
            : counterpart.getPhone();
        return switch (command.getPaymentType()) {
            case RECHARGE -> "Recharge for " + name;
            case BILL -> "Bill payment to " + name;
            case ADD_MONEY -> "Money added to wallet";
            default -> "Payment to " + name;
        };
    }

    private static String describe(PaymentType paymentType) {
        return switch (paymentType) {
            case TRANSFER -> "Transfer";
            case UPI -> "UPI payment";
            case BIOMETRIC -> "Biometric payment";
            case RECHARGE -> "Recharge";
            case BILL -> "Bill payment";
            case CARD -> "Card payment";
            case ADD_MONEY -> "Add money";
        };
    }

    private static String actorFor(UUID userId) {
        return "user:" + userId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private record Adjustment(UUID userId, long delta) {
    }
}
