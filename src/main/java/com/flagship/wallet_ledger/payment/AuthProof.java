package com.flagship.wallet_ledger.payment;

import com.flagship.wallet_ledger.verification.VerificationMethod;
import lombok.Value;

/**
 * What the payer presented to authorise the movement.
 */
@Value
public class AuthProof {
    VerificationMethod method;
    String proof;

    public static AuthProof pin(String pin) {
        return new AuthProof(VerificationMethod.PIN, pin);
    }

    public boolean isPresent() {
        return method != null && proof != null && !proof.isBlank();
    }
}
