package com.flagship.deposit_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.account.AccountType;
import com.flagship.deposit_ledger.ledger.LedgerTransaction;
import com.flagship.deposit_ledger.ledger.TransactionStatus;
import com.flagship.deposit_ledger.ledger.TransactionType;
import com.flagship.deposit_ledger.ledger.TransactionView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    /**
     * Only set in history listings.
     */
    @JsonProperty("account_type")
    AccountType accountType;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return builderFor(transaction).build();
    }

    public static TransactionResponse from(TransactionView view) {
        return builderFor(view.getTransaction())
            .accountType(view.getAccountType())
            .build();
    }

    private static TransactionResponseBuilder builderFor(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .description(transaction.getDescription())
            .status(transaction.getStatus())
            .createdAt(transaction.getCreatedAt())
            .processedAt(transaction.getProcessedAt());
    }
}
