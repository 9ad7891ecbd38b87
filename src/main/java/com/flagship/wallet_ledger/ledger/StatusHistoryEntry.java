package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * One append-only record of a status change.
 */
@Value
public class StatusHistoryEntry {
    TransactionStatus status;
    Instant timestamp;
    String reason;
    String actor;
}
