package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between major units (rupees, as carried in REST payloads) and
 * the minor units (paisa) everything else works in.
 */
public final class Money {

    private static final int MINOR_DIGITS = 2;

    private Money() {
    }

    /**
     * @throws ValidationException if the amount is missing, has more than two
     *         fraction digits or does not fit in a long
     */
    public static long toMinor(BigDecimal major) {
        if (major == null) {
            throw new ValidationException("Amount is required");
        }
        try {
            return major.setScale(MINOR_DIGITS, RoundingMode.UNNECESSARY)
                .movePointRight(MINOR_DIGITS)
                .longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount " + major.toPlainString() + " is not a valid currency amount");
        }
    }

    public static BigDecimal toMajor(long minor) {
        return BigDecimal.valueOf(minor, MINOR_DIGITS);
    }

    public static BigDecimal toMajor(Long minor) {
        return minor == null ? null : toMajor(minor.longValue());
    }
}
