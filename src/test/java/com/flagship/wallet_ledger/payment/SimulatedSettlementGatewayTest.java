package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.PaymentProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedSettlementGatewayTest {

    private final SettlementGateway.SettlementRequest request = new SettlementGateway.SettlementRequest(
        UUID.randomUUID(), "TXNTEST", PaymentType.RECHARGE, 19_900L, "INR");

    @Test
    @DisplayName("Full approval rate always approves with a gateway reference")
    void approves() {
        SimulatedSettlementGateway gateway = new SimulatedSettlementGateway(0, 1.0, new Random(42));

        SettlementGateway.SettlementResult result = gateway.settle(request);

        assertTrue(result.isApproved());
        assertTrue(result.getReference().startsWith("GW"));
        assertNull(result.getDeclineReason());
    }

    @Test
    @DisplayName("Zero approval rate always declines")
    void declines() {
        SimulatedSettlementGateway gateway = new SimulatedSettlementGateway(0, 0.0, new Random(42));

        SettlementGateway.SettlementResult result = gateway.settle(request);

        assertFalse(result.isApproved());
        assertNotNull(result.getDeclineReason());
    }

    @Test
    @DisplayName("An approved settlement can be voided by its reference")
    void voidsApprovedSettlement() {
        SimulatedSettlementGateway gateway = new SimulatedSettlementGateway(0, 1.0, new Random(7));
        String reference = gateway.settle(request).getReference();

        assertTrue(gateway.voidSettlement(request, reference));
    }

    @Test
    @DisplayName("Approval rate outside [0, 1] is a configuration error")
    void rejectsBadRate() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedSettlementGateway(0, 1.5, new Random()));
    }

    @Test
    @DisplayName("Interruption during the settlement delay surfaces as a processing error")
    void interrupted() throws InterruptedException {
        SimulatedSettlementGateway gateway = new SimulatedSettlementGateway(10_000, 1.0, new Random());
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread worker = new Thread(() -> {
            try {
                gateway.settle(request);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        worker.start();
        worker.interrupt();
        worker.join(5_000);

        assertInstanceOf(PaymentProcessingException.class, failure.get());
    }
}
