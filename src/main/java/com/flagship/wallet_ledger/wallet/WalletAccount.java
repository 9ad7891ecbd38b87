package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.PartyDetails;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a wallet. {@code balance} is as of the read.
 */
@Value
public class WalletAccount {
    UUID userId;
    String displayName;
    String email;
    String phone;
    String upiId;
    long balance;
    long openingBalance;
    Instant createdAt;

    /**
     * Identity snapshot to store on a ledger entry.
     */
    public PartyDetails toPartyDetails() {
        return PartyDetails.builder()
            .userId(userId)
            .name(displayName)
            .email(email)
            .phone(phone)
            .upiId(upiId)
            .build();
    }
}
