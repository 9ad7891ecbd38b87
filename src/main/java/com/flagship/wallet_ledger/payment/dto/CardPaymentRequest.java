package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.verification.VerificationMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Merchant payment funded by a card; the wallet balance is not touched.
 */
@Value
public class CardPaymentRequest {

    @NotBlank(message = "Merchant is required")
    @Size(max = 200, message = "Merchant must be at most 200 characters")
    @JsonProperty("merchant_name")
    String merchantName;

    @NotBlank(message = "Card last 4 digits are required")
    @Pattern(regexp = "^[0-9]{4}$", message = "Card last 4 must be four digits")
    @JsonProperty("card_last4")
    String cardLast4;

    @Size(max = 32, message = "Card brand must be at most 32 characters")
    @JsonProperty("card_brand")
    String cardBrand;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "Amount can have at most two decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("pin")
    String pin;

    @JsonProperty("biometric_type")
    VerificationMethod biometricType;

    @Size(max = 4096, message = "Biometric data must be at most 4096 characters")
    @JsonProperty("biometric_data")
    String biometricData;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;
}
