package com.flagship.deposit_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.account.Account;
import com.flagship.deposit_ledger.account.AccountStatus;
import com.flagship.deposit_ledger.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("status")
    AccountStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .accountType(account.getAccountType())
            .balance(account.getBalance())
            .status(account.getStatus())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
