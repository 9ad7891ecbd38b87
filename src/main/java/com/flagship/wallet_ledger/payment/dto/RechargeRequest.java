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
 * Mobile or DTH recharge.
 */
@Value
public class RechargeRequest {

    @NotBlank(message = "Mobile or subscriber number is required")
    @Size(max = 32, message = "Mobile or subscriber number must be at most 32 characters")
    @JsonProperty("mobile_number")
    String mobileNumber;

    @NotBlank(message = "Operator is required")
    @Size(max = 100, message = "Operator must be at most 100 characters")
    @JsonProperty("operator")
    String operator;

    @Size(max = 32, message = "Recharge type must be at most 32 characters")
    @JsonProperty("recharge_type")
    String rechargeType;

    @Size(max = 100, message = "Plan must be at most 100 characters")
    @JsonProperty("plan")
    String plan;

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
