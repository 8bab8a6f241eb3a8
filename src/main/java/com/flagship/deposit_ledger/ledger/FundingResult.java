package com.flagship.deposit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a successful funding. Both fields were read back from the store.
 */
@Value
public class FundingResult {
    LedgerTransaction transaction;
    BigDecimal newBalance;
}
