package com.flagship.deposit_ledger.exception;

import com.flagship.deposit_ledger.validation.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Input was rejected by one or more validation checks.
 * The full list of violations is kept so the caller can fix every field at once.
 */
public class ValidationFailedException extends LedgerException {

    private final List<Violation> violations;

    public ValidationFailedException(List<Violation> violations) {
        super(violations.stream()
                .map(Violation::getMessage)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
