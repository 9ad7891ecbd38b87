package com.flagship.wallet_ledger.ledger;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;

/**
 * Generates human-facing transaction IDs: {@code TXN}, the epoch millis in
 * base 36, then six random base-36 characters, all upper case.
 *
 * Uniqueness is not guaranteed here; the store retries on a collision.
 */
@Component
public class TransactionIdGenerator {

    static final String PREFIX = "TXN";
    private static final int SUFFIX_LENGTH = 6;
    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TransactionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        StringBuilder id = new StringBuilder(PREFIX)
            .append(Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT));
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
