package com.flagship.wallet_ledger.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionPage;
import com.flagship.wallet_ledger.ledger.dto.TransactionResponse;
import lombok.Value;

import java.util.List;

@Value
public class StatementResponse {

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("pagination")
    Pagination pagination;

    public static StatementResponse from(TransactionPage page) {
        return new StatementResponse(
            page.getEntries().stream().map(TransactionResponse::from).toList(),
            new Pagination(page.getPage(), page.getLimit(), page.getTotal(), page.getTotalPages(), page.isHasNext()));
    }

    @Value
    public static class Pagination {

        @JsonProperty("page")
        int page;

        @JsonProperty("limit")
        int limit;

        @JsonProperty("total")
        long total;

        @JsonProperty("total_pages")
        int totalPages;

        @JsonProperty("has_next")
        boolean hasNext;
    }
}
