package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.exception.LedgerException;
import com.flagship.wallet_ledger.exception.PersistenceException;
import com.flagship.wallet_ledger.exception.SettlementFailedException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.StatusUpdate;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionDraft;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.verification.VerificationGate;
import com.flagship.wallet_ledger.verification.VerificationMethod;
import com.flagship.wallet_ledger.wallet.BalanceAccessor;
import com.flagship.wallet_ledger.wallet.WalletAccount;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure handling after the payer's entry exists: reversals, final status
 * and the error reported back.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentCompensationTest {

    private static final long AMOUNT = 50_000;
    private static final String PIN = "1234";

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private BalanceAccessor balanceAccessor;

    @Mock
    private VerificationGate verificationGate;

    @Mock
    private SettlementGateway settlementGateway;

    @Mock
    private IdempotencyService idempotencyService;

    private PaymentProcessor paymentProcessor;

    private final UUID senderId = UUID.randomUUID();
    private final UUID receiverId = UUID.randomUUID();
    private final Map<UUID, Long> balances = new HashMap<>();

    @BeforeEach
    void setUp() {
        paymentProcessor = new PaymentProcessor(ledgerStore, balanceAccessor, verificationGate, settlementGateway,
                idempotencyService, new LedgerMetrics(new SimpleMeterRegistry()));
        balances.put(senderId, 100_000L);
        balances.put(receiverId, 20_000L);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private WalletAccount account(UUID userId, String name) {
        return new WalletAccount(userId, name, name.toLowerCase() + "@example.com", null, null,
                balances.get(userId), balances.get(userId), Instant.EPOCH);
    }

    private LedgerTransaction entry(UUID owner, String transactionId, TransactionType type,
                                    TransactionDirection direction, TransactionStatus status) {
        return LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .transactionId(transactionId)
            .ownerUserId(owner)
            .type(type)
            .direction(direction)
            .amount(AMOUNT)
            .totalAmount(AMOUNT)
            .currency("INR")
            .status(status)
            .paymentMethod(PaymentMethod.WALLET)
            .build();
    }

    private void walletsBehaveNormally() {
        when(balanceAccessor.atomicAdjust(any(), anyLong()))
            .thenAnswer(invocation -> balances.merge(invocation.getArgument(0), invocation.getArgument(1), Long::sum));
    }

    private void transferPreconditions() {
        when(verificationGate.verify(senderId, VerificationMethod.PIN, PIN)).thenReturn(true);
        when(balanceAccessor.findUserByEmailOrPhone("bina@example.com")).thenReturn(receiverId);
        when(balanceAccessor.getAccount(senderId)).thenReturn(account(senderId, "Anil"));
        when(balanceAccessor.getAccount(receiverId)).thenReturn(account(receiverId, "Bina"));
    }

    private TransferCommand transfer() {
        return TransferCommand.builder()
            .recipientIdentifier("bina@example.com")
            .amount(AMOUNT)
            .authProof(AuthProof.pin(PIN))
            .build();
    }

    private StatusUpdate capturedUpdate(LedgerTransaction entry, TransactionStatus status) {
        ArgumentCaptor<StatusUpdate> captor = ArgumentCaptor.forClass(StatusUpdate.class);
        verify(ledgerStore).updateStatus(eq(entry.getId()), eq(status), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Receiver credit failure reverses the sender debit and fails the entry")
    void receiverCreditFails() {
        printTestHeader("Receiver Credit Failure");

        LedgerTransaction senderEntry = entry(senderId, "TXN1", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        transferPreconditions();
        walletsBehaveNormally();
        doThrow(new PersistenceException("Balance store unavailable"))
            .when(balanceAccessor).atomicAdjust(receiverId, AMOUNT);
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(senderEntry);

        PersistenceException e = assertThrows(PersistenceException.class,
                () -> paymentProcessor.processTransfer(senderId, transfer()));
        printOutput("Error", e.getCode() + " " + e.getMessage());

        assertEquals("TXN1", e.getTransactionId());
        assertEquals(100_000L, balances.get(senderId));
        assertEquals(20_000L, balances.get(receiverId));

        StatusUpdate update = capturedUpdate(senderEntry, TransactionStatus.FAILED);
        assertEquals("PERSISTENCE_ERROR", update.getErrorDetails().getCode());
        assertTrue(update.getErrorDetails().isRetryable());

        printSuccess("Sender made whole and entry FAILED");
    }

    @Test
    @DisplayName("A failed reversal leaves the entry ON_HOLD and not retryable")
    void reversalFails() {
        printTestHeader("Compensation Failure");

        LedgerTransaction senderEntry = entry(senderId, "TXN2", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        transferPreconditions();
        walletsBehaveNormally();
        doThrow(new PersistenceException("Balance store unavailable"))
            .when(balanceAccessor).atomicAdjust(receiverId, AMOUNT);
        doThrow(new PersistenceException("Still unavailable"))
            .when(balanceAccessor).atomicAdjust(senderId, AMOUNT);
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(senderEntry);

        LedgerException e = assertThrows(LedgerException.class,
                () -> paymentProcessor.processTransfer(senderId, transfer()));

        assertEquals("TXN2", e.getTransactionId());
        assertEquals(50_000L, balances.get(senderId));

        StatusUpdate update = capturedUpdate(senderEntry, TransactionStatus.ON_HOLD);
        printOutput("Reason", update.getReason());
        assertTrue(update.getReason().startsWith("Compensation failed"));
        assertFalse(update.getErrorDetails().isRetryable());
        verify(ledgerStore, never()).updateStatus(eq(senderEntry.getId()), eq(TransactionStatus.FAILED), any());

        printSuccess("Entry held for reconciliation");
    }

    @Test
    @DisplayName("Receiver leg write failure reverses both adjustments, latest first")
    void receiverLegWriteFails() {
        LedgerTransaction senderEntry = entry(senderId, "TXN3", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        transferPreconditions();
        walletsBehaveNormally();
        when(ledgerStore.create(any(TransactionDraft.class)))
            .thenReturn(senderEntry)
            .thenThrow(new PersistenceException("Ledger unavailable"));

        assertThrows(PersistenceException.class, () -> paymentProcessor.processTransfer(senderId, transfer()));

        InOrder order = inOrder(balanceAccessor);
        order.verify(balanceAccessor).atomicAdjust(senderId, -AMOUNT);
        order.verify(balanceAccessor).atomicAdjust(receiverId, AMOUNT);
        order.verify(balanceAccessor).atomicAdjust(receiverId, -AMOUNT);
        order.verify(balanceAccessor).atomicAdjust(senderId, AMOUNT);
        assertEquals(100_000L, balances.get(senderId));
        assertEquals(20_000L, balances.get(receiverId));
        capturedUpdate(senderEntry, TransactionStatus.FAILED);
    }

    @Test
    @DisplayName("Completion failure after both legs marks the receiver leg REFUNDED")
    void completionFailsAfterReceiverLeg() {
        LedgerTransaction senderEntry = entry(senderId, "TXN4", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        LedgerTransaction receiverEntry = entry(receiverId, "TXN5", TransactionType.TRANSFER,
                TransactionDirection.CREDIT, TransactionStatus.COMPLETED);
        transferPreconditions();
        walletsBehaveNormally();
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(senderEntry).thenReturn(receiverEntry);
        when(ledgerStore.updateStatus(eq(senderEntry.getId()), eq(TransactionStatus.COMPLETED), any()))
            .thenThrow(new PersistenceException("Lock wait timeout"));

        assertThrows(PersistenceException.class, () -> paymentProcessor.processTransfer(senderId, transfer()));

        verify(ledgerStore).updateStatus(eq(receiverEntry.getId()), eq(TransactionStatus.REFUNDED), any());
        capturedUpdate(senderEntry, TransactionStatus.FAILED);
        assertEquals(100_000L, balances.get(senderId));
        assertEquals(20_000L, balances.get(receiverId));
    }

    @Test
    @DisplayName("Receiver leg is REFUNDED when its credit was reversed even if the sender reversal fails")
    void senderReversalFailsAfterReceiverLeg() {
        printTestHeader("Partial Compensation After Receiver Leg");

        LedgerTransaction senderEntry = entry(senderId, "TXN8", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        LedgerTransaction receiverEntry = entry(receiverId, "TXN9", TransactionType.TRANSFER,
                TransactionDirection.CREDIT, TransactionStatus.COMPLETED);
        transferPreconditions();
        walletsBehaveNormally();
        doThrow(new PersistenceException("Balance store unavailable"))
            .when(balanceAccessor).atomicAdjust(senderId, AMOUNT);
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(senderEntry).thenReturn(receiverEntry);
        when(ledgerStore.updateStatus(eq(senderEntry.getId()), eq(TransactionStatus.COMPLETED), any()))
            .thenThrow(new PersistenceException("Lock wait timeout"));

        LedgerException e = assertThrows(LedgerException.class,
                () -> paymentProcessor.processTransfer(senderId, transfer()));
        printOutput("Balances", balances);

        assertEquals("TXN8", e.getTransactionId());
        assertEquals(20_000L, balances.get(receiverId));
        assertEquals(50_000L, balances.get(senderId));
        verify(ledgerStore).updateStatus(eq(receiverEntry.getId()), eq(TransactionStatus.REFUNDED), any());
        StatusUpdate update = capturedUpdate(senderEntry, TransactionStatus.ON_HOLD);
        assertFalse(update.getErrorDetails().isRetryable());

        printSuccess("Receiver leg refunded, sender entry held");
    }

    private PaymentCommand recharge() {
        return PaymentCommand.builder()
            .paymentType(PaymentType.RECHARGE)
            .amount(AMOUNT)
            .counterpart(PartyDetails.builder().name("Airtel").phone("9876543210").build())
            .authProof(AuthProof.pin(PIN))
            .build();
    }

    private LedgerTransaction settledRechargeLosesFundsRace(String transactionId) {
        LedgerTransaction entry = entry(senderId, transactionId, TransactionType.RECHARGE,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        when(verificationGate.verify(senderId, VerificationMethod.PIN, PIN)).thenReturn(true);
        when(balanceAccessor.getAccount(senderId)).thenReturn(account(senderId, "Anil"));
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(entry);
        when(settlementGateway.settle(any())).thenReturn(SettlementGateway.SettlementResult.approved("GW-REF-1"));
        when(balanceAccessor.atomicAdjust(senderId, -AMOUNT)).thenThrow(new InsufficientFundsException(senderId, AMOUNT));
        return entry;
    }

    @Test
    @DisplayName("A settled payment that cannot debit the wallet voids the settlement and keeps its reference")
    void settledThenDebitFails() {
        printTestHeader("Settlement Voided After Debit Failure");

        LedgerTransaction entry = settledRechargeLosesFundsRace("TXN10");
        when(settlementGateway.voidSettlement(any(), eq("GW-REF-1"))).thenReturn(true);

        assertThrows(InsufficientFundsException.class, () -> paymentProcessor.processPayment(senderId, recharge()));

        ArgumentCaptor<SettlementGateway.SettlementRequest> request =
                ArgumentCaptor.forClass(SettlementGateway.SettlementRequest.class);
        verify(settlementGateway).voidSettlement(request.capture(), eq("GW-REF-1"));
        assertEquals("TXN10", request.getValue().getTransactionId());

        StatusUpdate update = capturedUpdate(entry, TransactionStatus.FAILED);
        printOutput("Gateway reference", update.getGatewayReference());
        assertEquals("GW-REF-1", update.getGatewayReference());
        assertEquals("INSUFFICIENT_FUNDS", update.getErrorDetails().getCode());
        assertEquals(100_000L, balances.get(senderId));

        printSuccess("Settlement voided and reference recorded");
    }

    @Test
    @DisplayName("A settlement the gateway will not void leaves the entry ON_HOLD with its reference")
    void settlementVoidRefused() {
        LedgerTransaction entry = settledRechargeLosesFundsRace("TXN11");
        when(settlementGateway.voidSettlement(any(), eq("GW-REF-1"))).thenReturn(false);

        assertThrows(InsufficientFundsException.class, () -> paymentProcessor.processPayment(senderId, recharge()));

        StatusUpdate update = capturedUpdate(entry, TransactionStatus.ON_HOLD);
        assertEquals("GW-REF-1", update.getGatewayReference());
        assertTrue(update.getReason().startsWith("Compensation failed"));
        assertFalse(update.getErrorDetails().isRetryable());
        verify(ledgerStore, never()).updateStatus(eq(entry.getId()), eq(TransactionStatus.FAILED), any());
    }

    @Test
    @DisplayName("A gateway error while voiding is treated as an unvoided settlement")
    void settlementVoidThrows() {
        LedgerTransaction entry = settledRechargeLosesFundsRace("TXN12");
        when(settlementGateway.voidSettlement(any(), eq("GW-REF-1")))
            .thenThrow(new IllegalStateException("Gateway timeout"));

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> paymentProcessor.processPayment(senderId, recharge()));

        assertEquals("TXN12", e.getTransactionId());
        assertEquals("GW-REF-1", capturedUpdate(entry, TransactionStatus.ON_HOLD).getGatewayReference());
    }

    @Test
    @DisplayName("Gateway decline fails the entry without touching the wallet")
    void settlementDeclined() {
        printTestHeader("Settlement Declined");

        LedgerTransaction entry = entry(senderId, "TXN6", TransactionType.RECHARGE,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        when(verificationGate.verify(senderId, VerificationMethod.PIN, PIN)).thenReturn(true);
        when(balanceAccessor.getAccount(senderId)).thenReturn(account(senderId, "Anil"));
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(entry);
        when(settlementGateway.settle(any())).thenReturn(SettlementGateway.SettlementResult.declined("Operator unavailable"));

        SettlementFailedException e = assertThrows(SettlementFailedException.class,
                () -> paymentProcessor.processPayment(senderId, PaymentCommand.builder()
                    .paymentType(PaymentType.RECHARGE)
                    .amount(AMOUNT)
                    .counterpart(PartyDetails.builder().name("Airtel").phone("9876543210").build())
                    .authProof(AuthProof.pin(PIN))
                    .build()));
        printOutput("Error", e.getMessage());

        assertEquals("Operator unavailable", e.getMessage());
        verify(balanceAccessor, never()).atomicAdjust(any(), anyLong());
        verify(settlementGateway, never()).voidSettlement(any(), any());
        StatusUpdate update = capturedUpdate(entry, TransactionStatus.FAILED);
        assertEquals("SETTLEMENT_FAILED", update.getErrorDetails().getCode());
        assertFalse(update.getErrorDetails().isRetryable());

        printSuccess("Decline recorded, balance untouched");
    }

    @Test
    @DisplayName("An unrecordable failure still reaches the caller")
    void statusWriteFailsDuringFailure() {
        LedgerTransaction senderEntry = entry(senderId, "TXN7", TransactionType.TRANSFER,
                TransactionDirection.DEBIT, TransactionStatus.PROCESSING);
        transferPreconditions();
        walletsBehaveNormally();
        doThrow(new PersistenceException("Balance store unavailable"))
            .when(balanceAccessor).atomicAdjust(receiverId, AMOUNT);
        when(ledgerStore.create(any(TransactionDraft.class))).thenReturn(senderEntry);
        when(ledgerStore.updateStatus(eq(senderEntry.getId()), eq(TransactionStatus.FAILED), any()))
            .thenThrow(new PersistenceException("Ledger unavailable"));

        PersistenceException e = assertThrows(PersistenceException.class,
                () -> paymentProcessor.processTransfer(senderId, transfer()));

        assertEquals("Balance store unavailable", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals(100_000L, balances.get(senderId));
    }
}
