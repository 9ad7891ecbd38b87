package com.flagship.wallet_ledger.payment;

import lombok.Value;

import java.util.UUID;

/**
 * External settlement system (card network, biller, operator).
 */
public interface SettlementGateway {

    SettlementResult settle(SettlementRequest request);

    /**
     * Voids a settlement approved earlier under {@code reference}, used when
     * the wallet side of the payment could not be completed.
     *
     * @return true when the gateway confirmed the void
     */
    boolean voidSettlement(SettlementRequest request, String reference);

    @Value
    class SettlementRequest {
        UUID ledgerEntryId;
        String transactionId;
        PaymentType paymentType;
        long amount;
        String currency;
    }

    @Value
    class SettlementResult {
        boolean approved;
        String reference;
        String declineReason;

        public static SettlementResult approved(String reference) {
            return new SettlementResult(true, reference, null);
        }

        public static SettlementResult declined(String reason) {
            return new SettlementResult(false, null, reason);
        }
    }
}
