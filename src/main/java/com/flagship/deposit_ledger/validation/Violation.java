package com.flagship.deposit_ledger.validation;

import lombok.Value;

/**
 * One failed validation check: which field, which rule, and a message fit for the end user.
 */
@Value(staticConstructor = "of")
public class Violation {
    String field;
    String rule;
    String message;
}
