package com.flagship.deposit_ledger.observability;

import com.flagship.deposit_ledger.account.AccountType;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.fundings: funding attempts, tagged by outcome
 * - ledger.funding.amount: distribution of credited amounts
 * - ledger.accounts.opened: account openings, tagged by type and outcome
 * - ledger.operation.latency: timer per operation (fund, open_account, list_transactions)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final DistributionSummary fundingAmount;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.fundingAmount = DistributionSummary.builder("ledger.funding.amount")
                .description("Amounts credited by successful fundings")
                .baseUnit("usd")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordFunding(String status) {
        registry.counter("ledger.fundings", "status", sanitizeTag(status)).increment();
    }

    public void recordFundingAmount(BigDecimal amount) {
        fundingAmount.record(amount.doubleValue());
    }

    public void recordAccountOpened(AccountType accountType, String status) {
        registry.counter("ledger.accounts.opened",
                "account_type", accountType.label(),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values to a small, safe alphabet so a stray message cannot blow up cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
