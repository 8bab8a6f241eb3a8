package com.flagship.deposit_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.deposit_ledger.ledger.FundingRequest;
import com.flagship.deposit_ledger.ledger.FundingSource;
import com.flagship.deposit_ledger.ledger.FundingSourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request body for funding an account.
 *
 * Only shape is checked here; amount limits and funding source rules are
 * enforced by the ledger's own validator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FundAccountRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;

    @NotNull(message = "Funding source is required")
    @Valid
    @JsonProperty("funding_source")
    private Source fundingSource;

    public FundingRequest toFundingRequest() {
        return new FundingRequest(amount,
            new FundingSource(fundingSource.getType(), fundingSource.getAccountNumber(),
                fundingSource.getRoutingNumber()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Source {

        @NotNull(message = "Funding source type is required")
        @JsonProperty("type")
        private FundingSourceType type;

        @JsonProperty("account_number")
        private String accountNumber;

        @JsonProperty("routing_number")
        private String routingNumber;
    }
}
