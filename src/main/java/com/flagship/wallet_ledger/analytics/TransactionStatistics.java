package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregates over an owner's entries in a period. Totals and the type and
 * method breakdowns count completed entries only; the status breakdown
 * covers every status. Amounts are minor units of {@code amount}, never
 * {@code totalAmount}.
 */
@Value
@Builder
public class TransactionStatistics {
    Instant from;
    Instant to;
    long totalTransactions;
    long totalAmount;
    long totalFees;
    long totalDebits;
    long totalCredits;
    long averageAmount;
    Map<TransactionType, Bucket> byType;
    Map<TransactionStatus, Bucket> byStatus;
    Map<PaymentMethod, Bucket> byPaymentMethod;
}
