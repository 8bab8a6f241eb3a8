package com.flagship.deposit_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.ledger.FundingResult;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class FundingResponse {

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    public static FundingResponse from(FundingResult result) {
        return new FundingResponse(TransactionResponse.from(result.getTransaction()), result.getNewBalance());
    }
}
