package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for money movement.
 *
 * - ledger.payments: counter tagged by payment type and outcome
 * - ledger.payments.latency: timer tagged by operation
 * - ledger.idempotency: lookup hits and misses
 * - ledger.compensations: saga reversals by result
 * - ledger.sweeper.flagged: entries moved to on_hold by the sweeper
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPayment(String paymentType, String outcome) {
        registry.counter("ledger.payments",
                "type", sanitizeTag(paymentType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        Timer.builder("ledger.payments.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    public void recordCompensation(boolean succeeded) {
        registry.counter("ledger.compensations", "result", succeeded ? "success" : "failure").increment();
    }

    public void recordSweeperFlagged(int count) {
        registry.counter("ledger.sweeper.flagged").increment(count);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
