package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.exception.AccountConflictException;
import com.flagship.deposit_ledger.exception.InternalFailureException;
import com.flagship.deposit_ledger.exception.LedgerException;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Opens accounts and serves owner-scoped account reads.
 *
 * Opening runs in an explicit {@link TransactionTemplate} rather than behind
 * {@code @Transactional} so that commit failures surface here and can be
 * reported as {@link InternalFailureException}.
 */
@Service
@Slf4j
public class AccountService {

    static final String OWNER_TYPE_CONSTRAINT = "uq_accounts_owner_type";

    private final AccountStore accountStore;
    private final AccountNumberGenerator accountNumberGenerator;
    private final OwnershipGuard ownershipGuard;
    private final LedgerMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public AccountService(AccountStore accountStore,
                          AccountNumberGenerator accountNumberGenerator,
                          OwnershipGuard ownershipGuard,
                          LedgerMetrics metrics,
                          PlatformTransactionManager transactionManager) {
        this.accountStore = accountStore;
        this.accountNumberGenerator = accountNumberGenerator;
        this.ownershipGuard = ownershipGuard;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    /**
     * Opens a zero-balance ACTIVE account of the given type for the owner.
     *
     * @return the account as read back from the store after the insert
     * @throws AccountConflictException if the owner already has an account of this type
     * @throws InternalFailureException if the insert could not be committed or read back
     */
    public Account openAccount(long ownerId, AccountType accountType) {
        long startTime = System.currentTimeMillis();
        try {
            Account account = transactionTemplate.execute(status -> insertAccount(ownerId, accountType));
            if (account == null) {
                throw new InternalFailureException("Account creation returned no result");
            }
            metrics.recordAccountOpened(accountType, "success");
            log.info("Opened {} account id={} for owner {}", accountType.label(), account.getId(), ownerId);
            return account;
        } catch (LedgerException e) {
            metrics.recordAccountOpened(accountType, e.getClass().getSimpleName());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordAccountOpened(accountType, "internal_failure");
            log.error("Account opening failed for owner {}", ownerId, e);
            throw new InternalFailureException("Account could not be created. Please try again.", e);
        } finally {
            metrics.recordLatency("open_account", System.currentTimeMillis() - startTime);
        }
    }

    public List<Account> listAccounts(long ownerId) {
        return readOnlyTemplate.execute(status -> accountStore.findByOwner(ownerId));
    }

    /**
     * Returns the caller's account, freshly read from the store.
     */
    public Account getAccount(long callerId, long accountId) {
        return readOnlyTemplate.execute(status -> ownershipGuard.requireOwnedAccount(callerId, accountId));
    }

    private Account insertAccount(long ownerId, AccountType accountType) {
        if (accountStore.existsByOwnerAndType(ownerId, accountType)) {
            throw new AccountConflictException(accountType);
        }

        String accountNumber = accountNumberGenerator.generate();
        long accountId;
        try {
            accountId = accountStore.insert(ownerId, accountNumber, accountType);
        } catch (DuplicateKeyException e) {
            // a concurrent open for the same owner and type won the race
            if (isOwnerTypeViolation(e)) {
                throw new AccountConflictException(accountType, e);
            }
            throw e;
        }

        return accountStore.findById(accountId)
            .orElseThrow(() -> new InternalFailureException(
                "Account was created but could not be retrieved. Please try again."));
    }

    private static boolean isOwnerTypeViolation(DuplicateKeyException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause.getMessage() != null && cause.getMessage().contains(OWNER_TYPE_CONSTRAINT)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
