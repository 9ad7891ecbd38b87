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
 * Peer transfer to a wallet named by e-mail, phone or UPI id.
 */
@Value
public class TransferRequest {

    @NotBlank(message = "Recipient is required")
    @Size(max = 320, message = "Recipient must be at most 320 characters")
    @JsonProperty("recipient")
    String recipient;

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

    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;
}
