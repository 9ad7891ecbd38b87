package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.PaymentProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;

/**
 * Stand-in for a real gateway: waits a fixed delay, then approves with the
 * configured probability. Holds no state between calls.
 */
@Component
@Slf4j
public class SimulatedSettlementGateway implements SettlementGateway {

    private final long delayMs;
    private final double approvalRate;
    private final Random random;

    @Autowired
    public SimulatedSettlementGateway(@Value("${ledger.settlement.delay-ms:500}") long delayMs,
                                      @Value("${ledger.settlement.approval-rate:1.0}") double approvalRate) {
        this(delayMs, approvalRate, new SecureRandom());
    }

    SimulatedSettlementGateway(long delayMs, double approvalRate, Random random) {
        if (approvalRate < 0.0 || approvalRate > 1.0) {
            throw new IllegalArgumentException("Approval rate must be within [0, 1]: " + approvalRate);
        }
        this.delayMs = delayMs;
        this.approvalRate = approvalRate;
        this.random = random;
    }

    @Override
    public SettlementResult settle(SettlementRequest request) {
        pause();
        if (random.nextDouble() >= approvalRate) {
            log.info("Settlement declined: transactionId={}, type={}", request.getTransactionId(), request.getPaymentType());
            return SettlementResult.declined("Declined by " + request.getPaymentType().name().toLowerCase(Locale.ROOT) + " gateway");
        }
        String reference = "GW" + Long.toUnsignedString(random.nextLong(), 36).toUpperCase(Locale.ROOT);
        log.debug("Settlement approved: transactionId={}, reference={}", request.getTransactionId(), reference);
        return SettlementResult.approved(reference);
    }

    @Override
    public boolean voidSettlement(SettlementRequest request, String reference) {
        pause();
        log.info("Settlement voided: transactionId={}, reference={}", request.getTransactionId(), reference);
        return true;
    }

    private void pause() {
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PaymentProcessingException("Interrupted while waiting for the gateway", e);
            }
        }
    }
}
