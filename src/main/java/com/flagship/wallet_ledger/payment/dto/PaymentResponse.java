package com.flagship.wallet_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.dto.TransactionResponse;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a money movement: the caller's ledger entry and their wallet
 * balance right after it.
 */
@Value
public class PaymentResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("new_balance")
    BigDecimal newBalance;
}
