package com.flagship.wallet_ledger.ledger;

public enum PaymentMethod {
    UPI,
    CARD,
    WALLET,
    BIOMETRIC,
    BANK_TRANSFER,
    NET_BANKING,
    CASH
}
