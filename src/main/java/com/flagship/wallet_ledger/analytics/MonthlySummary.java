package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Completed activity of one calendar month. {@code dailyBreakdown} holds a
 * row per day with activity, oldest first.
 */
@Value
@Builder
public class MonthlySummary {
    int year;
    int month;
    long totalTransactions;
    long totalDebits;
    long totalCredits;
    long netFlow;
    Map<TransactionType, Bucket> byType;
    List<DailyBreakdown> dailyBreakdown;
}
