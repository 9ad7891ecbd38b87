package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("currency")
    String currency;
}
