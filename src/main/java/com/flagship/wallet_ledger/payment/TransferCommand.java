package com.flagship.wallet_ledger.payment;

import lombok.Builder;
import lombok.Value;

/**
 * Peer transfer. The recipient is named by e-mail, phone or UPI address.
 */
@Value
@Builder
public class TransferCommand {
    String recipientIdentifier;
    Long amount;
    AuthProof authProof;
    String note;
    String externalReferenceId;
}
