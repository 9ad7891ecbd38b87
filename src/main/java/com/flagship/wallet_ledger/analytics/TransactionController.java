package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.analytics.dto.MonthlySummaryResponse;
import com.flagship.wallet_ledger.analytics.dto.ReconciliationResponse;
import com.flagship.wallet_ledger.analytics.dto.StatementResponse;
import com.flagship.wallet_ledger.analytics.dto.StatisticsResponse;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionFilter;
import com.flagship.wallet_ledger.ledger.TransactionSortField;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.ledger.dto.TransactionResponse;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Statement, lookup and reporting endpoints over the caller's own ledger.
 * Entries that belong to someone else are reported as not found.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final AnalyticsService analyticsService;
    private final LedgerStore ledgerStore;

    @GetMapping
    public ResponseEntity<StatementResponse> statement(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) List<TransactionType> type,
            @RequestParam(required = false) List<TransactionStatus> status,
            @RequestParam(name = "payment_method", required = false) List<PaymentMethod> paymentMethod,
            @RequestParam(required = false) TransactionDirection direction,
            @RequestParam(name = "start_date", required = false) Instant startDate,
            @RequestParam(name = "end_date", required = false) Instant endDate,
            @RequestParam(name = "min_amount", required = false) BigDecimal minAmount,
            @RequestParam(name = "max_amount", required = false) BigDecimal maxAmount,
            @RequestParam(required = false) String category,
            @RequestParam(name = "sort_by", defaultValue = "createdAt") String sortBy,
            @RequestParam(name = "sort_order", defaultValue = "desc") String sortOrder) {
        TransactionFilter.TransactionFilterBuilder filter = TransactionFilter.builder()
            .page(page)
            .limit(limit)
            .direction(direction)
            .from(startDate)
            .to(endDate)
            .minAmount(minAmount == null ? null : Money.toMinor(minAmount))
            .maxAmount(maxAmount == null ? null : Money.toMinor(maxAmount))
            .category(category)
            .sortBy(TransactionSortField.fromParam(sortBy))
            .sortDirection("asc".equalsIgnoreCase(sortOrder) ? Sort.Direction.ASC : Sort.Direction.DESC);
        if (type != null) {
            filter.types(type);
        }
        if (status != null) {
            filter.statuses(status);
        }
        if (paymentMethod != null) {
            filter.paymentMethods(paymentMethod);
        }
        return ResponseEntity.ok(StatementResponse.from(analyticsService.statement(userId, filter.build())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getById(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                       @PathVariable UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(ledgerStore.findOwnedById(userId, id)));
    }

    @GetMapping("/reference/{transactionId}")
    public ResponseEntity<TransactionResponse> getByTransactionId(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                                  @PathVariable String transactionId) {
        return ResponseEntity.ok(TransactionResponse.from(ledgerStore.findOwnedByTransactionId(userId, transactionId)));
    }

    @GetMapping("/recent")
    public ResponseEntity<List<TransactionResponse>> recent(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                            @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(analyticsService.recent(userId, limit).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    /**
     * Either a {@code period} shortcut or an explicit {@code start_date}/{@code end_date}
     * range; with neither, all time.
     */
    @GetMapping("/statistics")
    public ResponseEntity<StatisticsResponse> statistics(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(required = false) String period,
            @RequestParam(name = "start_date", required = false) Instant startDate,
            @RequestParam(name = "end_date", required = false) Instant endDate) {
        TransactionStatistics statistics = period != null
            ? analyticsService.statistics(userId, StatisticsPeriod.fromParam(period))
            : analyticsService.statistics(userId, startDate, endDate);
        return ResponseEntity.ok(StatisticsResponse.from(statistics));
    }

    @GetMapping("/monthly-summary")
    public ResponseEntity<MonthlySummaryResponse> monthlySummary(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                                 @RequestParam int year,
                                                                 @RequestParam int month) {
        return ResponseEntity.ok(MonthlySummaryResponse.from(analyticsService.monthlySummary(userId, year, month)));
    }

    @GetMapping("/search")
    public ResponseEntity<List<TransactionResponse>> search(@RequestHeader(USER_ID_HEADER) UUID userId,
                                                            @RequestParam(name = "q", required = false) String query,
                                                            @RequestParam(defaultValue = "50") int limit) {
        log.debug("Ledger search: userId={}, query={}", userId, query);
        return ResponseEntity.ok(analyticsService.search(userId, query, limit).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconciliation(@RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(ReconciliationResponse.from(analyticsService.reconcile(userId)));
    }
}
