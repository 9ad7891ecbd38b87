package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionFilter;
import com.flagship.wallet_ledger.ledger.TransactionPage;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.wallet.BalanceAccessor;
import com.flagship.wallet_ledger.wallet.WalletAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Read-only reporting over the ledger: statements, statistics, monthly
 * summaries, search and reconciliation. Nothing here writes.
 *
 * Calendar boundaries (today, month start, day buckets) are taken in
 * {@code ledger.analytics.zone-id}.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class AnalyticsService {

    static final int MAX_RECENT = 20;

    private static final Instant EARLIEST = Instant.parse("1970-01-01T00:00:00Z");
    private static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private final AnalyticsRepository repository;
    private final LedgerStore ledgerStore;
    private final BalanceAccessor balanceAccessor;
    private final Clock clock;
    private final ZoneId zone;

    public AnalyticsService(AnalyticsRepository repository,
                            LedgerStore ledgerStore,
                            BalanceAccessor balanceAccessor,
                            Clock clock,
                            @Value("${ledger.analytics.zone-id:UTC}") String zoneId) {
        this.repository = repository;
        this.ledgerStore = ledgerStore;
        this.balanceAccessor = balanceAccessor;
        this.clock = clock;
        this.zone = ZoneId.of(zoneId);
    }

    public TransactionPage statement(UUID ownerId, TransactionFilter filter) {
        return ledgerStore.findByOwner(ownerId, filter);
    }

    /**
     * Newest entries first, at most {@value #MAX_RECENT}.
     */
    public List<LedgerTransaction> recent(UUID ownerId, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        return ledgerStore.findByOwner(ownerId, TransactionFilter.firstPage(Math.min(limit, MAX_RECENT)))
            .getEntries();
    }

    public List<LedgerTransaction> search(UUID ownerId, String query, int limit) {
        return ledgerStore.search(ownerId, query, limit);
    }

    public TransactionStatistics statistics(UUID ownerId, StatisticsPeriod period) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        return statistics(ownerId, period.startAt(now), now.toInstant());
    }

    /**
     * @param from inclusive lower bound, or {@code null} for no bound
     * @param to inclusive upper bound, or {@code null} for no bound
     */
    public TransactionStatistics statistics(UUID ownerId, Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("Start date must not be after end date");
        }
        Instant lower = from != null ? from : EARLIEST;
        Instant upper = to != null ? to : LATEST;

        long count = 0;
        long amount = 0;
        long fees = 0;
        long debits = 0;
        long credits = 0;
        for (Object[] row : repository.sumByDirection(ownerId, TransactionStatus.COMPLETED, lower, upper)) {
            long rowAmount = asLong(row[2]);
            count += asLong(row[1]);
            amount += rowAmount;
            fees += asLong(row[3]);
            if (row[0] == TransactionDirection.CREDIT) {
                credits += rowAmount;
            } else {
                debits += rowAmount;
            }
        }

        return TransactionStatistics.builder()
            .from(from)
            .to(to)
            .totalTransactions(count)
            .totalAmount(amount)
            .totalFees(fees)
            .totalDebits(debits)
            .totalCredits(credits)
            .averageAmount(count == 0 ? 0 : BigDecimal.valueOf(amount)
                .divide(BigDecimal.valueOf(count), 0, RoundingMode.HALF_UP)
                .longValueExact())
            .byType(buckets(TransactionType.class,
                repository.sumByType(ownerId, TransactionStatus.COMPLETED, lower, upper)))
            .byPaymentMethod(buckets(PaymentMethod.class,
                repository.sumByPaymentMethod(ownerId, TransactionStatus.COMPLETED, lower, upper)))
            .byStatus(buckets(TransactionStatus.class,
                repository.sumByStatus(ownerId, lower, upper)))
            .build();
    }

    /**
     * Completed activity between the first and the last instant of the month.
     */
    public MonthlySummary monthlySummary(UUID ownerId, int year, int month) {
        if (month < 1 || month > 12) {
            throw new ValidationException("Month must be between 1 and 12");
        }
        if (year < 1970 || year > 9999) {
            throw new ValidationException("Year " + year + " is out of range");
        }
        YearMonth yearMonth = YearMonth.of(year, month);
        Instant from = yearMonth.atDay(1).atStartOfDay(zone).toInstant();
        Instant to = yearMonth.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant().minusNanos(1);

        long debits = 0;
        long credits = 0;
        long count = 0;
        Map<TransactionType, Bucket> byType = new EnumMap<>(TransactionType.class);
        Map<LocalDate, long[]> days = new TreeMap<>();

        for (Object[] row : repository.findActivity(ownerId, TransactionStatus.COMPLETED, from, to)) {
            LocalDate day = ((Instant) row[0]).atZone(zone).toLocalDate();
            boolean credit = row[1] == TransactionDirection.CREDIT;
            TransactionType type = (TransactionType) row[2];
            long amount = asLong(row[3]);

            count++;
            if (credit) {
                credits += amount;
            } else {
                debits += amount;
            }
            byType.merge(type, new Bucket(1, amount), (a, b) -> a.plus(b.getCount(), b.getAmount()));

            long[] totals = days.computeIfAbsent(day, d -> new long[3]);
            totals[credit ? 1 : 0] += amount;
            totals[2]++;
        }

        List<DailyBreakdown> daily = new ArrayList<>(days.size());
        days.forEach((day, totals) -> daily.add(new DailyBreakdown(day, totals[0], totals[1], totals[2])));

        return MonthlySummary.builder()
            .year(year)
            .month(month)
            .totalTransactions(count)
            .totalDebits(debits)
            .totalCredits(credits)
            .netFlow(credits - debits)
            .byType(byType)
            .dailyBreakdown(daily)
            .build();
    }

    /**
     * Checks the live balance against opening balance plus completed
     * balance-affecting history. Entries left ON_HOLD after a failed
     * compensation show up here as a discrepancy.
     */
    public ReconciliationReport reconcile(UUID ownerId) {
        WalletAccount account = balanceAccessor.getAccount(ownerId);
        long credits = 0;
        long debits = 0;
        for (Object[] row : repository.sumBalanceAffectingTotals(ownerId, TransactionStatus.COMPLETED)) {
            if (row[0] == TransactionDirection.CREDIT) {
                credits = asLong(row[1]);
            } else {
                debits = asLong(row[1]);
            }
        }
        long expected = account.getOpeningBalance() + credits - debits;
        ReconciliationReport report = new ReconciliationReport(ownerId, account.getOpeningBalance(),
                credits, debits, expected, account.getBalance());
        if (!report.isBalanced()) {
            log.warn("Reconciliation mismatch: userId={}, expected={}, actual={}, discrepancy={}",
                    ownerId, expected, account.getBalance(), report.getDiscrepancy());
        }
        return report;
    }

    private static <E extends Enum<E>> Map<E, Bucket> buckets(Class<E> keyType, List<Object[]> rows) {
        Map<E, Bucket> buckets = new EnumMap<>(keyType);
        for (Object[] row : rows) {
            if (row[0] != null) {
                buckets.put(keyType.cast(row[0]), new Bucket(asLong(row[1]), asLong(row[2])));
            }
        }
        return buckets;
    }

    private static long asLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
