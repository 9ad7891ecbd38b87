package com.flagship.wallet_ledger.analytics;

import com.flagship.wallet_ledger.exception.ValidationException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.StatusUpdate;
import com.flagship.wallet_ledger.ledger.TransactionDraft;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.payment.AuthProof;
import com.flagship.wallet_ledger.payment.PaymentCommand;
import com.flagship.wallet_ledger.payment.PaymentProcessor;
import com.flagship.wallet_ledger.payment.PaymentType;
import com.flagship.wallet_ledger.wallet.OpenWalletCommand;
import com.flagship.wallet_ledger.wallet.WalletAccount;
import com.flagship.wallet_ledger.wallet.WalletAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregate views over the ledger.
 */
@SpringBootTest
@ActiveProfiles("test")
class AnalyticsServiceTest {

    @Autowired
    private AnalyticsService analyticsService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private WalletAccountService walletAccountService;

    @Autowired
    private PaymentProcessor paymentProcessor;

    private UUID ownerId;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerTransaction completed(TransactionType type, long amount, long fee, PaymentMethod method) {
        return ledgerStore.create(TransactionDraft.builder()
            .ownerUserId(ownerId)
            .type(type)
            .amount(amount)
            .fee(fee)
            .paymentMethod(method)
            .initialStatus(TransactionStatus.COMPLETED)
            .description(type + " via " + method)
            .build());
    }

    private void createdAt(LedgerTransaction entry, String isoInstant) {
        jdbcTemplate.update("UPDATE ledger_transactions SET created_at = ? WHERE id = ?",
                OffsetDateTime.ofInstant(Instant.parse(isoInstant), ZoneOffset.UTC), entry.getId());
    }

    @Nested
    @DisplayName("Monthly summary")
    class Monthly {

        @Test
        @DisplayName("March 2024: two debits and one credit on distinct days")
        void marchSummary() {
            printTestHeader("Monthly Summary 2024-03");

            createdAt(completed(TransactionType.PAYMENT, 10_000, 0, PaymentMethod.UPI), "2024-03-03T09:15:00Z");
            createdAt(completed(TransactionType.BILL_PAYMENT, 5_000, 0, PaymentMethod.WALLET), "2024-03-10T18:40:00Z");
            createdAt(completed(TransactionType.ADD_MONEY, 30_000, 0, PaymentMethod.CARD), "2024-03-21T07:05:00Z");
            createdAt(completed(TransactionType.PAYMENT, 99_000, 0, PaymentMethod.UPI), "2024-04-01T00:00:00Z");
            createdAt(completed(TransactionType.PAYMENT, 77_000, 0, PaymentMethod.UPI), "2024-02-29T23:59:59Z");

            LedgerTransaction failed = ledgerStore.create(TransactionDraft.builder()
                .ownerUserId(ownerId)
                .type(TransactionType.PAYMENT)
                .amount(4_000L)
                .paymentMethod(PaymentMethod.UPI)
                .initialStatus(TransactionStatus.PROCESSING)
                .build());
            ledgerStore.updateStatus(failed.getId(), TransactionStatus.FAILED, StatusUpdate.of("Declined", "system"));
            createdAt(failed, "2024-03-15T12:00:00Z");

            MonthlySummary summary = analyticsService.monthlySummary(ownerId, 2024, 3);
            printOutput("Summary", summary);

            assertEquals(3, summary.getTotalTransactions());
            assertEquals(15_000, summary.getTotalDebits());
            assertEquals(30_000, summary.getTotalCredits());
            assertEquals(15_000, summary.getNetFlow());
            assertEquals(new Bucket(1, 10_000), summary.getByType().get(TransactionType.PAYMENT));
            assertEquals(new Bucket(1, 30_000), summary.getByType().get(TransactionType.ADD_MONEY));

            List<DailyBreakdown> days = summary.getDailyBreakdown();
            assertEquals(3, days.size());
            assertEquals(new DailyBreakdown(LocalDate.of(2024, 3, 3), 10_000, 0, 1), days.get(0));
            assertEquals(new DailyBreakdown(LocalDate.of(2024, 3, 10), 5_000, 0, 1), days.get(1));
            assertEquals(new DailyBreakdown(LocalDate.of(2024, 3, 21), 0, 30_000, 1), days.get(2));
            assertEquals(summary.getTotalDebits(), days.stream().mapToLong(DailyBreakdown::getDebits).sum());
            assertEquals(summary.getTotalCredits(), days.stream().mapToLong(DailyBreakdown::getCredits).sum());

            printSuccess("Only completed March entries counted, days in order");
        }

        @Test
        @DisplayName("Empty month has zero totals and no days")
        void emptyMonth() {
            MonthlySummary summary = analyticsService.monthlySummary(ownerId, 2023, 11);

            assertEquals(0, summary.getTotalTransactions());
            assertEquals(0, summary.getNetFlow());
            assertTrue(summary.getDailyBreakdown().isEmpty());
        }

        @Test
        @DisplayName("Month outside 1..12 is rejected")
        void invalidMonth() {
            assertThrows(ValidationException.class, () -> analyticsService.monthlySummary(ownerId, 2024, 13));
            assertThrows(ValidationException.class, () -> analyticsService.monthlySummary(ownerId, 2024, 0));
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("Totals and breakdowns over completed entries, status over all")
        void totalsAndBreakdowns() {
            printTestHeader("Statistics");

            completed(TransactionType.PAYMENT, 10_000, 100, PaymentMethod.UPI);
            completed(TransactionType.CASHBACK, 501, 0, PaymentMethod.WALLET);
            LedgerTransaction failed = ledgerStore.create(TransactionDraft.builder()
                .ownerUserId(ownerId)
                .type(TransactionType.PAYMENT)
                .amount(2_000L)
                .paymentMethod(PaymentMethod.UPI)
                .initialStatus(TransactionStatus.PROCESSING)
                .build());
            ledgerStore.updateStatus(failed.getId(), TransactionStatus.FAILED, StatusUpdate.of("Declined", "system"));

            TransactionStatistics stats = analyticsService.statistics(ownerId, null, null);
            printOutput("Statistics", stats);

            assertEquals(2, stats.getTotalTransactions());
            assertEquals(10_501, stats.getTotalAmount());
            assertEquals(100, stats.getTotalFees());
            assertEquals(10_000, stats.getTotalDebits());
            assertEquals(501, stats.getTotalCredits());
            assertEquals(5_251, stats.getAverageAmount());
            assertEquals(new Bucket(1, 10_000), stats.getByType().get(TransactionType.PAYMENT));
            assertEquals(new Bucket(1, 501), stats.getByType().get(TransactionType.CASHBACK));
            assertEquals(new Bucket(1, 10_000), stats.getByPaymentMethod().get(PaymentMethod.UPI));
            assertEquals(2, stats.getByStatus().get(TransactionStatus.COMPLETED).getCount());
            assertEquals(new Bucket(1, 2_000), stats.getByStatus().get(TransactionStatus.FAILED));

            printSuccess("Aggregates computed");
        }

        @Test
        @DisplayName("Period and range bounds restrict the entries counted")
        void boundedRange() {
            completed(TransactionType.PAYMENT, 1_000, 0, PaymentMethod.UPI);

            assertEquals(1, analyticsService.statistics(ownerId, StatisticsPeriod.TODAY).getTotalTransactions());
            assertEquals(1, analyticsService.statistics(ownerId, StatisticsPeriod.YEAR).getTotalTransactions());

            Instant tomorrow = Instant.now().plus(Duration.ofDays(1));
            TransactionStatistics future = analyticsService.statistics(ownerId, tomorrow, tomorrow.plus(Duration.ofDays(1)));
            assertEquals(0, future.getTotalTransactions());
            assertEquals(0, future.getAverageAmount());
            assertTrue(future.getByType().isEmpty());
        }

        @Test
        @DisplayName("Start after end is rejected")
        void invertedRange() {
            Instant now = Instant.now();
            assertThrows(ValidationException.class,
                () -> analyticsService.statistics(ownerId, now, now.minusSeconds(60)));
        }
    }

    @Nested
    @DisplayName("Recent and reconciliation")
    class RecentAndReconciliation {

        @Test
        @DisplayName("Recent is newest first and capped")
        void recent() {
            for (int i = 1; i <= 25; i++) {
                completed(TransactionType.PAYMENT, i * 100L, 0, PaymentMethod.UPI);
            }

            assertEquals(AnalyticsService.MAX_RECENT, analyticsService.recent(ownerId, 50).size());
            List<LedgerTransaction> latest = analyticsService.recent(ownerId, 3);
            assertEquals(3, latest.size());
            assertFalse(latest.get(0).getCreatedAt().isBefore(latest.get(2).getCreatedAt()));
            assertThrows(ValidationException.class, () -> analyticsService.recent(ownerId, 0));
        }

        @Test
        @DisplayName("Balance matches history until it is changed outside the ledger")
        void reconciliation() {
            printTestHeader("Reconciliation");

            WalletAccount wallet = walletAccountService.openWallet(OpenWalletCommand.builder()
                .displayName("Recon User")
                .email("recon." + ownerId + "@example.com")
                .openingBalance(10_000)
                .pin("8642")
                .build());
            paymentProcessor.processPayment(wallet.getUserId(), PaymentCommand.builder()
                .paymentType(PaymentType.UPI)
                .amount(2_000L)
                .fee(50)
                .counterpart(PartyDetails.builder().name("Pharmacy").upiId("pharmacy@upi").build())
                .authProof(AuthProof.pin("8642"))
                .build());
            paymentProcessor.processPayment(wallet.getUserId(), PaymentCommand.builder()
                .paymentType(PaymentType.ADD_MONEY)
                .amount(500L)
                .counterpart(PartyDetails.builder().name("SBI").build())
                .build());

            ReconciliationReport report = analyticsService.reconcile(wallet.getUserId());
            printOutput("Report", report);
            assertTrue(report.isBalanced());
            assertEquals(2_050, report.getCompletedDebits());
            assertEquals(500, report.getCompletedCredits());
            assertEquals(8_450, report.getActualBalance());

            jdbcTemplate.update("UPDATE wallet_accounts SET balance = balance - 100 WHERE user_id = ?", wallet.getUserId());

            ReconciliationReport drifted = analyticsService.reconcile(wallet.getUserId());
            assertFalse(drifted.isBalanced());
            assertEquals(-100, drifted.getDiscrepancy());

            printSuccess("Drift detected");
        }
    }
}
