package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Top-up of the wallet from a card, UPI or bank account.
 */
@Value
public class AddMoneyRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "Amount can have at most two decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @Size(max = 4, message = "Card last 4 must be at most 4 characters")
    @JsonProperty("card_last4")
    String cardLast4;

    @Size(max = 32, message = "Card brand must be at most 32 characters")
    @JsonProperty("card_brand")
    String cardBrand;

    @Size(max = 100, message = "Bank name must be at most 100 characters")
    @JsonProperty("bank_name")
    String bankName;

    @Size(max = 100, message = "UPI id must be at most 100 characters")
    @JsonProperty("upi_id")
    String upiId;
}
