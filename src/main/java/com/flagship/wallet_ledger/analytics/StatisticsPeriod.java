package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Named look-back windows, all ending now.
 */
public enum StatisticsPeriod {
    TODAY,
    WEEK,
    MONTH,
    YEAR;

    public Instant startAt(ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        ZoneId zone = now.getZone();
        switch (this) {
            case TODAY:
                return today.atStartOfDay(zone).toInstant();
            case WEEK:
                return now.toInstant().minus(Duration.ofDays(7));
            case MONTH:
                return today.withDayOfMonth(1).atStartOfDay(zone).toInstant();
            case YEAR:
                return today.withDayOfYear(1).atStartOfDay(zone).toInstant();
            default:
                throw new IllegalStateException("Unhandled period " + this);
        }
    }

    public static StatisticsPeriod fromParam(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown period '" + value + "', expected today, week, month or year");
        }
    }
}
