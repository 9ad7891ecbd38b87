package com.flagship.wallet_ledger.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.analytics.DailyBreakdown;
import com.flagship.wallet_ledger.analytics.MonthlySummary;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class MonthlySummaryResponse {

    @JsonProperty("year")
    int year;

    @JsonProperty("month")
    int month;

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("total_debits")
    BigDecimal totalDebits;

    @JsonProperty("total_credits")
    BigDecimal totalCredits;

    @JsonProperty("net_flow")
    BigDecimal netFlow;

    @JsonProperty("by_type")
    Map<String, BucketResponse> byType;

    @JsonProperty("daily_breakdown")
    List<Day> dailyBreakdown;

    public static MonthlySummaryResponse from(MonthlySummary summary) {
        return MonthlySummaryResponse.builder()
            .year(summary.getYear())
            .month(summary.getMonth())
            .totalTransactions(summary.getTotalTransactions())
            .totalDebits(Money.toMajor(summary.getTotalDebits()))
            .totalCredits(Money.toMajor(summary.getTotalCredits()))
            .netFlow(Money.toMajor(summary.getNetFlow()))
            .byType(BucketResponse.fromMap(summary.getByType()))
            .dailyBreakdown(summary.getDailyBreakdown().stream().map(Day::from).toList())
            .build();
    }

    @Value
    public static class Day {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("debits")
        BigDecimal debits;

        @JsonProperty("credits")
        BigDecimal credits;

        @JsonProperty("count")
        long count;

        static Day from(DailyBreakdown day) {
            return new Day(day.getDate(), Money.toMajor(day.getDebits()), Money.toMajor(day.getCredits()), day.getCount());
        }
    }
}
