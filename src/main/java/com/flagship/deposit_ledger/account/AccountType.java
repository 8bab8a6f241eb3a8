package com.flagship.deposit_ledger.account;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Kind of deposit account. An owner holds at most one account of each type.
 */
public enum AccountType {
    CHECKING,
    SAVINGS;

    public String label() {
        return name().toLowerCase();
    }

    /**
     * Accepts the type in any case ("checking", "SAVINGS").
     */
    @JsonCreator
    public static AccountType fromValue(String value) {
        for (AccountType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + value);
    }
}
