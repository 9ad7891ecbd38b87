package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Snapshot of a counterpart's identity taken when the entry is written.
 *
 * Not a live reference: receipts keep showing the name and address the
 * counterpart had at the time, whatever they change later.
 */
@Embeddable
@Getter
@Builder
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PartyDetails {

    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "phone", length = 32)
    private String phone;

    @Column(name = "upi_id", length = 100)
    private String upiId;

    @Column(name = "account_number", length = 64)
    private String accountNumber;
}
