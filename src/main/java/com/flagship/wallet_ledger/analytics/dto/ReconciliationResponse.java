package com.flagship.wallet_ledger.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.analytics.ReconciliationReport;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ReconciliationResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("completed_credits")
    BigDecimal completedCredits;

    @JsonProperty("completed_debits")
    BigDecimal completedDebits;

    @JsonProperty("expected_balance")
    BigDecimal expectedBalance;

    @JsonProperty("actual_balance")
    BigDecimal actualBalance;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(ReconciliationReport report) {
        return new ReconciliationResponse(
            report.getUserId(),
            Money.toMajor(report.getOpeningBalance()),
            Money.toMajor(report.getCompletedCredits()),
            Money.toMajor(report.getCompletedDebits()),
            Money.toMajor(report.getExpectedBalance()),
            Money.toMajor(report.getActualBalance()),
            Money.toMajor(report.getDiscrepancy()),
            report.isBalanced());
    }
}
