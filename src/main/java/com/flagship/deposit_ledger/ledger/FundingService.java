package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.account.Account;
import com.flagship.deposit_ledger.account.AccountStore;
import com.flagship.deposit_ledger.account.OwnershipGuard;
import com.flagship.deposit_ledger.config.LedgerProperties;
import com.flagship.deposit_ledger.exception.AccountNotFoundException;
import com.flagship.deposit_ledger.exception.InternalFailureException;
import com.flagship.deposit_ledger.exception.InvalidAccountStateException;
import com.flagship.deposit_ledger.exception.LedgerException;
import com.flagship.deposit_ledger.observability.CorrelationContext;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import com.flagship.deposit_ledger.validation.FundingRequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Credits an account from an external funding source.
 *
 * This service enforces the core invariants:
 * 1. A funding either inserts exactly one transaction AND raises the balance by
 *    exactly the amount, or changes nothing
 * 2. The balance is only ever adjusted relatively ({@code balance = balance + ?}),
 *    so concurrent fundings of one account cannot overwrite each other
 * 3. The returned transaction and balance are read back from the store, never
 *    computed in memory; a failed read-back fails the whole funding
 *
 * The database transaction is driven by a {@link TransactionTemplate} so that a
 * failure at commit time is caught here and reported as {@link InternalFailureException}.
 */
@Service
@Slf4j
public class FundingService {

    private static final int MONEY_SCALE = 2;

    private final AccountStore accountStore;
    private final TransactionLog transactionLog;
    private final OwnershipGuard ownershipGuard;
    private final FundingRequestValidator validator;
    private final LedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public FundingService(AccountStore accountStore,
                          TransactionLog transactionLog,
                          OwnershipGuard ownershipGuard,
                          FundingRequestValidator validator,
                          LedgerMetrics metrics,
                          PlatformTransactionManager transactionManager,
                          LedgerProperties properties) {
        this.accountStore = accountStore;
        this.transactionLog = transactionLog;
        this.ownershipGuard = ownershipGuard;
        this.validator = validator;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(
            timeoutSeconds(properties.getFunding().getTransactionTimeout()));
    }

    /**
     * Whole seconds for the transaction timeout, rounded up. A timeout of 0 would
     * expire the transaction before its first statement.
     */
    static int timeoutSeconds(Duration timeout) {
        long seconds = timeout.toSeconds() + (timeout.toNanosPart() > 0 ? 1 : 0);
        return Math.toIntExact(Math.max(1L, seconds));
    }

    /**
     * Funds an account owned by the caller.
     *
     * @param callerId identity of the authenticated caller
     * @param accountId account to credit
     * @param request amount and funding source
     * @return the new transaction and the balance read back after the credit
     * @throws com.flagship.deposit_ledger.exception.ValidationFailedException if the request is invalid
     * @throws AccountNotFoundException if the account does not exist or is not the caller's
     * @throws InvalidAccountStateException if the account is not ACTIVE
     * @throws InternalFailureException if the store failed; nothing was committed and a retry is safe
     */
    public FundingResult fund(long callerId, long accountId, FundingRequest request) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));

        try {
            validator.requireValid(request);
            BigDecimal amount = request.getAmount().setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);

            FundingResult result = transactionTemplate.execute(
                status -> applyFunding(callerId, accountId, amount, request.getFundingSource()));
            if (result == null) {
                throw new InternalFailureException("Funding returned no result");
            }

            metrics.recordFunding("success");
            metrics.recordFundingAmount(amount);
            log.info("Funded account: transactionId={}, amount={}, newBalance={}",
                    result.getTransaction().getId(), amount, result.getNewBalance());
            return result;

        } catch (LedgerException e) {
            metrics.recordFunding(e.getClass().getSimpleName());
            log.warn("Funding rejected: {}", e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordFunding("internal_failure");
            log.error("Funding failed in the store, nothing committed", e);
            throw new InternalFailureException("Funding could not be completed. No money was moved.", e);
        } finally {
            metrics.recordLatency("fund", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private FundingResult applyFunding(long callerId, long accountId, BigDecimal amount, FundingSource source) {
        Account account = ownershipGuard.requireOwnedAccount(callerId, accountId);
        if (!account.isActive()) {
            throw new InvalidAccountStateException(account.getStatus());
        }

        long transactionId = transactionLog.append(
            accountId, TransactionType.DEPOSIT, amount, "Funding from " + source.getType().label());

        int updated = accountStore.applyCredit(accountId, amount);
        if (updated != 1) {
            // status changed between the ownership check and the update
            throw new InvalidAccountStateException(accountStore.findById(accountId)
                .map(Account::getStatus)
                .orElseThrow(AccountNotFoundException::new));
        }

        LedgerTransaction transaction = transactionLog.findById(transactionId)
            .orElseThrow(() -> new InternalFailureException(
                "Transaction " + transactionId + " was recorded but could not be retrieved"));

        // read while this transaction still holds the row lock, so it is the value that commits
        BigDecimal newBalance = accountStore.findBalance(accountId)
            .orElseThrow(() -> new InternalFailureException(
                "Balance of account " + accountId + " could not be retrieved after funding"));

        return new FundingResult(transaction, newBalance);
    }
}
