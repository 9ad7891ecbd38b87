package com.flagship.wallet_ledger.verification;

public enum VerificationMethod {
    PIN,
    FINGERPRINT,
    FACE,
    VOICE,
    PATTERN;

    public boolean isBiometric() {
        return this != PIN;
    }
}
