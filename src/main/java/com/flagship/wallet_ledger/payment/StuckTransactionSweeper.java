package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.exception.LedgerException;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.StatusUpdate;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Moves entries that have sat in PROCESSING past {@code ledger.sweeper.stuck-after}
 * to ON_HOLD, where they wait for manual reconciliation.
 */
@Component
@ConditionalOnProperty(name = "ledger.sweeper.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class StuckTransactionSweeper {

    static final String ACTOR = "system:sweeper";

    private final LedgerStore ledgerStore;
    private final LedgerMetrics metrics;
    private final Duration stuckAfter;
    private final int batchSize;

    public StuckTransactionSweeper(LedgerStore ledgerStore,
                                   LedgerMetrics metrics,
                                   @Value("${ledger.sweeper.stuck-after:PT5M}") Duration stuckAfter,
                                   @Value("${ledger.sweeper.batch-size:100}") int batchSize) {
        this.ledgerStore = ledgerStore;
        this.metrics = metrics;
        this.stuckAfter = stuckAfter;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${ledger.sweeper.interval-ms:60000}")
    public void sweepScheduled() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Stuck transaction sweep failed", e);
        }
    }

    /**
     * @return number of entries moved to ON_HOLD
     */
    public int sweep() {
        List<UUID> stuck = ledgerStore.findStuckProcessing(stuckAfter, batchSize);
        if (stuck.isEmpty()) {
            return 0;
        }

        int flagged = 0;
        for (UUID id : stuck) {
            try {
                ledgerStore.updateStatus(id, TransactionStatus.ON_HOLD,
                        StatusUpdate.of("Processing exceeded " + stuckAfter + "; held for reconciliation", ACTOR));
                flagged++;
            } catch (LedgerException e) {
                // completed or failed between the scan and the lock
                log.info("Skipped entry {} during sweep: {}", id, e.getMessage());
            }
        }

        metrics.recordSweeperFlagged(flagged);
        log.warn("Sweeper moved {} of {} stuck entries to ON_HOLD", flagged, stuck.size());
        return flagged;
    }
}
