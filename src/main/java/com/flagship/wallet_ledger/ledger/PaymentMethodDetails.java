package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Method-specific metadata. Only the fields relevant to the entry's
 * {@link PaymentMethod} are populated.
 */
@Embeddable
@Getter
@Builder
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PaymentMethodDetails {

    @Column(name = "card_last4", length = 4)
    private String cardLast4;

    @Column(name = "card_brand", length = 32)
    private String cardBrand;

    @Column(name = "method_upi_id", length = 100)
    private String upiId;

    @Column(name = "upi_app", length = 64)
    private String upiApp;

    @Column(name = "bank_name", length = 100)
    private String bankName;

    @Column(name = "bank_account_last4", length = 4)
    private String bankAccountLast4;

    @Column(name = "wallet_name", length = 64)
    private String walletName;

    @Column(name = "biometric_type", length = 32)
    private String biometricType;
}
