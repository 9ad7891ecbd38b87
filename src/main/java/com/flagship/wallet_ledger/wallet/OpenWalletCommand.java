package com.flagship.wallet_ledger.wallet;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Wallet provisioning input. {@code userId} may be null to have one assigned.
 */
@Value
@Builder
public class OpenWalletCommand {
    UUID userId;
    String displayName;
    String email;
    String phone;
    String upiId;
    long openingBalance;
    String pin;
}
