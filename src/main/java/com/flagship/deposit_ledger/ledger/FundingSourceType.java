package com.flagship.deposit_ledger.ledger;

public enum FundingSourceType {
    CARD,
    BANK;

    public String label() {
        return name().toLowerCase();
    }
}
