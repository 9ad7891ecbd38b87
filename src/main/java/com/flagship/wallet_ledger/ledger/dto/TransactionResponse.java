package com.flagship.wallet_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.ErrorDetails;
import com.flagship.wallet_ledger.ledger.LedgerTransaction;
import com.flagship.wallet_ledger.ledger.PartyDetails;
import com.flagship.wallet_ledger.ledger.PaymentMethod;
import com.flagship.wallet_ledger.ledger.PaymentMethodDetails;
import com.flagship.wallet_ledger.ledger.StatusHistoryEntry;
import com.flagship.wallet_ledger.ledger.TransactionDirection;
import com.flagship.wallet_ledger.ledger.TransactionStatus;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.wallet.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ledger entry as returned over HTTP, amounts in major units.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("direction")
    TransactionDirection direction;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("tax")
    BigDecimal tax;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("status_history")
    List<StatusHistoryEntry> statusHistory;

    @JsonProperty("sender")
    PartyDetails sender;

    @JsonProperty("receiver")
    PartyDetails receiver;

    @JsonProperty("balance_before")
    BigDecimal balanceBefore;

    @JsonProperty("balance_after")
    BigDecimal balanceAfter;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("payment_method_details")
    PaymentMethodDetails paymentMethodDetails;

    @JsonProperty("external_reference_id")
    String externalReferenceId;

    @JsonProperty("gateway_reference")
    String gatewayReference;

    @JsonProperty("description")
    String description;

    @JsonProperty("remarks")
    String remarks;

    @JsonProperty("category")
    String category;

    @JsonProperty("error_details")
    ErrorDetails errorDetails;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .transactionId(transaction.getTransactionId())
            .type(transaction.getType())
            .direction(transaction.getDirection())
            .amount(Money.toMajor(transaction.getAmount()))
            .fee(Money.toMajor(transaction.getFee()))
            .tax(Money.toMajor(transaction.getTax()))
            .totalAmount(Money.toMajor(transaction.getTotalAmount()))
            .currency(transaction.getCurrency())
            .status(transaction.getStatus())
            .statusHistory(transaction.getStatusHistory())
            .sender(transaction.getSenderDetails())
            .receiver(transaction.getReceiverDetails())
            .balanceBefore(Money.toMajor(transaction.getBalanceBefore()))
            .balanceAfter(Money.toMajor(transaction.getBalanceAfter()))
            .paymentMethod(transaction.getPaymentMethod())
            .paymentMethodDetails(transaction.getPaymentMethodDetails())
            .externalReferenceId(transaction.getExternalReferenceId())
            .gatewayReference(transaction.getGatewayReference())
            .description(transaction.getDescription())
            .remarks(transaction.getRemarks())
            .category(transaction.getCategory())
            .errorDetails(transaction.getErrorDetails())
            .metadata(transaction.getMetadata())
            .createdAt(transaction.getCreatedAt())
            .completedAt(transaction.getCompletedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
