package com.flagship.wallet_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Side data carried by a status transition.
 */
@Value
@Builder
public class StatusUpdate {
    String reason;
    @Builder.Default
    String actor = "system";
    Long balanceAfter;
    String gatewayReference;
    ErrorDetails errorDetails;

    public static StatusUpdate of(String reason, String actor) {
        return StatusUpdate.builder().reason(reason).actor(actor).build();
    }
}
