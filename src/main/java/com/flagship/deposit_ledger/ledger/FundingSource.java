package com.flagship.deposit_ledger.ledger;

import lombok.Value;

/**
 * Where the money comes from. Number formats (Luhn, 9-digit routing) are
 * checked before the request reaches the ledger.
 */
@Value
public class FundingSource {
    FundingSourceType type;
    String accountNumber;
    String routingNumber;

    public static FundingSource card(String cardNumber) {
        return new FundingSource(FundingSourceType.CARD, cardNumber, null);
    }

    public static FundingSource bank(String accountNumber, String routingNumber) {
        return new FundingSource(FundingSourceType.BANK, accountNumber, routingNumber);
    }
}
