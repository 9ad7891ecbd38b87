package com.flagship.wallet_ledger.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.analytics.TransactionStatistics;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class StatisticsResponse {

    @JsonProperty("start_date")
    Instant startDate;

    @JsonProperty("end_date")
    Instant endDate;

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("total_fees")
    BigDecimal totalFees;

    @JsonProperty("total_debits")
    BigDecimal totalDebits;

    @JsonProperty("total_credits")
    BigDecimal totalCredits;

    @JsonProperty("average_amount")
    BigDecimal averageAmount;

    @JsonProperty("by_type")
    Map<String, BucketResponse> byType;

    @JsonProperty("by_status")
    Map<String, BucketResponse> byStatus;

    @JsonProperty("by_payment_method")
    Map<String, BucketResponse> byPaymentMethod;

    public static StatisticsResponse from(TransactionStatistics statistics) {
        return StatisticsResponse.builder()
            .startDate(statistics.getFrom())
            .endDate(statistics.getTo())
            .totalTransactions(statistics.getTotalTransactions())
            .totalAmount(Money.toMajor(statistics.getTotalAmount()))
            .totalFees(Money.toMajor(statistics.getTotalFees()))
            .totalDebits(Money.toMajor(statistics.getTotalDebits()))
            .totalCredits(Money.toMajor(statistics.getTotalCredits()))
            .averageAmount(Money.toMajor(statistics.getAverageAmount()))
            .byType(BucketResponse.fromMap(statistics.getByType()))
            .byStatus(BucketResponse.fromMap(statistics.getByStatus()))
            .byPaymentMethod(BucketResponse.fromMap(statistics.getByPaymentMethod()))
            .build();
    }
}
