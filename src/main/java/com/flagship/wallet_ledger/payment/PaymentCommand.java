package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.PaymentMethodDetails;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A non-transfer money movement. Amounts are minor units.
 * {@code paymentMethod} overrides the use case's default when set.
 */
@Value
@Builder
public class PaymentCommand {
    PaymentType paymentType;
    Long amount;
    @Builder.Default
    long fee = 0L;
    @Builder.Default
    long tax = 0L;
    PartyDetails counterpart;
    AuthProof authProof;
    PaymentMethod paymentMethod;
    PaymentMethodDetails paymentMethodDetails;
    String description;
    String remarks;
    String category;
    Map<String, String> metadata;
    String externalReferenceId;
}
