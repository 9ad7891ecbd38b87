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
 * Utility bill payment.
 */
@Value
public class BillPaymentRequest {

    @NotBlank(message = "Biller is required")
    @Size(max = 200, message = "Biller must be at most 200 characters")
    @JsonProperty("biller_name")
    String billerName;

    @Size(max = 64, message = "Bill category must be at most 64 characters")
    @JsonProperty("bill_category")
    String billCategory;

    @NotBlank(message = "Consumer number is required")
    @Size(max = 64, message = "Consumer number must be at most 64 characters")
    @JsonProperty("consumer_number")
    String consumerNumber;

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
}
