package com.flagship.wallet_ledger.analytics;

import lombok.Value;

import java.util.UUID;

/**
 * Opening balance plus completed balance-affecting credits minus debits,
 * set against the wallet's live balance.
 */
@Value
public class ReconciliationReport {
    UUID userId;
    long openingBalance;
    long completedCredits;
    long completedDebits;
    long expectedBalance;
    long actualBalance;

    public long getDiscrepancy() {
        return actualBalance - expectedBalance;
    }

    public boolean isBalanced() {
        return actualBalance == expectedBalance;
    }
}
