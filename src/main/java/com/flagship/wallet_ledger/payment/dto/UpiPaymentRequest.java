package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.verification.VerificationMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment to a UPI address.
 */
@Value
public class UpiPaymentRequest {

    @NotBlank(message = "UPI id is required")
    @Size(max = 100, message = "UPI id must be at most 100 characters")
    @JsonProperty("upi_id")
    String upiId;

    @Size(max = 200, message = "Recipient name must be at most 200 characters")
    @JsonProperty("recipient_name")
    String recipientName;

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

    @Size(max = 64, message = "UPI app must be at most 64 characters")
    @JsonProperty("upi_app")
    String upiApp;

    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;
}
