package com.flagship.deposit_ledger.validation;

import com.flagship.deposit_ledger.config.LedgerProperties;
import com.flagship.deposit_ledger.exception.ValidationFailedException;
import com.flagship.deposit_ledger.ledger.FundingRequest;
import com.flagship.deposit_ledger.ledger.FundingSource;
import com.flagship.deposit_ledger.ledger.FundingSourceType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates a funding request as a fixed sequence of named checks.
 *
 * Every check runs and contributes at most one {@link Violation}; a check whose
 * input is missing passes, since the matching presence check already reports it.
 * Nothing is coerced: a zero amount is rejected, never rounded up to the minimum.
 */
@Component
public class FundingRequestValidator {

    static final int MAX_SCALE = 2;

    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;

    public FundingRequestValidator(LedgerProperties properties) {
        this(properties.getFunding().getMinAmount(), properties.getFunding().getMaxAmount());
    }

    FundingRequestValidator(BigDecimal minAmount, BigDecimal maxAmount) {
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    public List<Violation> validate(FundingRequest request) {
        if (request == null) {
            return List.of(Violation.of("request", "required", "Funding request is required"));
        }
        BigDecimal amount = request.getAmount();
        FundingSource source = request.getFundingSource();

        List<Violation> violations = new ArrayList<>();
        amountPresent(amount).ifPresent(violations::add);
        amountPositive(amount).ifPresent(violations::add);
        amountHasAtMostTwoDecimals(amount).ifPresent(violations::add);
        amountAtLeastMinimum(amount).ifPresent(violations::add);
        amountAtMostMaximum(amount).ifPresent(violations::add);
        fundingSourcePresent(source).ifPresent(violations::add);
        fundingSourceTypePresent(source).ifPresent(violations::add);
        fundingSourceAccountNumberPresent(source).ifPresent(violations::add);
        routingNumberPresentForBank(source).ifPresent(violations::add);
        return violations;
    }

    /**
     * @throws ValidationFailedException carrying every violation found
     */
    public void requireValid(FundingRequest request) {
        List<Violation> violations = validate(request);
        if (!violations.isEmpty()) {
            throw new ValidationFailedException(violations);
        }
    }

    Optional<Violation> amountPresent(BigDecimal amount) {
        return amount == null
            ? Optional.of(Violation.of("amount", "required", "Amount is required"))
            : Optional.empty();
    }

    Optional<Violation> amountPositive(BigDecimal amount) {
        if (amount == null || amount.signum() > 0) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("amount", "positive", "Amount must be greater than $0.00"));
    }

    Optional<Violation> amountHasAtMostTwoDecimals(BigDecimal amount) {
        if (amount == null || amount.stripTrailingZeros().scale() <= MAX_SCALE) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("amount", "scale", "Amount cannot have more than 2 decimal places"));
    }

    Optional<Violation> amountAtLeastMinimum(BigDecimal amount) {
        // non-positive amounts are already reported by amountPositive
        if (amount == null || amount.signum() <= 0 || amount.compareTo(minAmount) >= 0) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("amount", "minimum", "Amount must be at least $" + minAmount.toPlainString()));
    }

    Optional<Violation> amountAtMostMaximum(BigDecimal amount) {
        if (amount == null || amount.compareTo(maxAmount) <= 0) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("amount", "maximum", "Amount cannot exceed $" + maxAmount.toPlainString()));
    }

    Optional<Violation> fundingSourcePresent(FundingSource source) {
        return source == null
            ? Optional.of(Violation.of("funding_source", "required", "Funding source is required"))
            : Optional.empty();
    }

    Optional<Violation> fundingSourceTypePresent(FundingSource source) {
        if (source == null || source.getType() != null) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("funding_source.type", "required", "Funding source type is required"));
    }

    Optional<Violation> fundingSourceAccountNumberPresent(FundingSource source) {
        if (source == null || (source.getAccountNumber() != null && !source.getAccountNumber().isBlank())) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("funding_source.account_number", "required",
            "Funding source account number is required"));
    }

    Optional<Violation> routingNumberPresentForBank(FundingSource source) {
        if (source == null || source.getType() != FundingSourceType.BANK) {
            return Optional.empty();
        }
        if (source.getRoutingNumber() != null && !source.getRoutingNumber().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Violation.of("funding_source.routing_number", "required",
            "Routing number is required for bank transfers"));
    }
}
