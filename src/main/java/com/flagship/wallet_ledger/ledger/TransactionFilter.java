package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.Set;

/**
 * Statement query: filters, ordering and 1-based pagination.
 * Amount bounds are minor units and apply to {@code amount}, not the total.
 */
@Value
@Builder
public class TransactionFilter {
    @Builder.Default
    int page = 1;
    @Builder.Default
    int limit = 20;
    @Singular
    Set<TransactionType> types;
    @Singular
    Set<TransactionStatus> statuses;
    @Singular
    Set<PaymentMethod> paymentMethods;
    TransactionDirection direction;
    Instant from;
    Instant to;
    Long minAmount;
    Long maxAmount;
    String category;
    @Builder.Default
    TransactionSortField sortBy = TransactionSortField.CREATED_AT;
    @Builder.Default
    Sort.Direction sortDirection = Sort.Direction.DESC;

    public static TransactionFilter firstPage(int limit) {
        return TransactionFilter.builder().limit(limit).build();
    }
}
