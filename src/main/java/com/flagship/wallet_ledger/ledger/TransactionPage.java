package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * One page of a statement plus the metadata a client needs to page through it.
 */
@Value
public class TransactionPage {
    List<LedgerTransaction> entries;
    long total;
    int page;
    int limit;

    public int getTotalPages() {
        return (int) ((total + limit - 1) / limit);
    }

    public boolean isHasNext() {
        return page < getTotalPages();
    }
}
