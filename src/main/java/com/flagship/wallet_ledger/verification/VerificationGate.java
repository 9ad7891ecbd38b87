package com.flagship.wallet_ledger.verification;

import java.util.UUID;

/**
 * Authorisation check run before any funds move.
 */
public interface VerificationGate {

    /**
     * @return whether {@code proof} authorises {@code userId} by {@code method};
     *         a wrong or unknown proof is {@code false}, never an exception
     */
    boolean verify(UUID userId, VerificationMethod method, String proof);
}
