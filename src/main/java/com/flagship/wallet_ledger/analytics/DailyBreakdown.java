package com.flagship.wallet_ledger.analytics;

import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyBreakdown {
    LocalDate date;
    long debits;
    long credits;
    long count;
}
