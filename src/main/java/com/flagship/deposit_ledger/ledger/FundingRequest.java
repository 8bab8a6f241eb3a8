package com.flagship.deposit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class FundingRequest {
    BigDecimal amount;
    FundingSource fundingSource;
}
