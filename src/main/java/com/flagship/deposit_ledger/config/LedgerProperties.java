package com.flagship.deposit_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed view of the {@code ledger.*} configuration block.
 *
 * Defaults match the limits enforced by the account funding form.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    @Valid
    private final Funding funding = new Funding();

    @Valid
    private final AccountNumber accountNumber = new AccountNumber();

    @Getter
    @Setter
    public static class Funding {

        @NotNull
        @DecimalMin("0.01")
        private BigDecimal minAmount = new BigDecimal("0.01");

        @NotNull
        @DecimalMin("0.01")
        private BigDecimal maxAmount = new BigDecimal("10000.00");

        /**
         * Upper bound on how long a funding transaction may hold the account row lock.
         */
        @NotNull
        @DurationMin(seconds = 1)
        private Duration transactionTimeout = Duration.ofSeconds(10);

        @AssertTrue(message = "min-amount must not exceed max-amount")
        public boolean isAmountRangeOrdered() {
            return minAmount == null || maxAmount == null || minAmount.compareTo(maxAmount) <= 0;
        }
    }

    @Getter
    @Setter
    public static class AccountNumber {

        @Min(1)
        private int maxAttempts = 10;
    }
}
