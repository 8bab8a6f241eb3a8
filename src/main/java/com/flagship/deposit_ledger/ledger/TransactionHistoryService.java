package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.account.Account;
import com.flagship.deposit_ledger.account.OwnershipGuard;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only view of an account's transaction history.
 */
@Service
@Slf4j
public class TransactionHistoryService {

    private final OwnershipGuard ownershipGuard;
    private final TransactionLog transactionLog;
    private final LedgerMetrics metrics;

    public TransactionHistoryService(OwnershipGuard ownershipGuard,
                                     TransactionLog transactionLog,
                                     LedgerMetrics metrics) {
        this.ownershipGuard = ownershipGuard;
        this.transactionLog = transactionLog;
        this.metrics = metrics;
    }

    /**
     * Lists every transaction of the caller's account, newest first.
     *
     * Order is (created_at DESC, id DESC), so repeated calls over unchanged data
     * return the same sequence. The account type comes from the account loaded by
     * the ownership check; no per-transaction account lookup is made.
     *
     * @return the history, empty if the account has never been funded
     * @throws com.flagship.deposit_ledger.exception.AccountNotFoundException if the
     *         account does not exist or is not the caller's
     */
    @Transactional(readOnly = true)
    public List<TransactionView> listTransactions(long callerId, long accountId) {
        long startTime = System.currentTimeMillis();
        try {
            Account account = ownershipGuard.requireOwnedAccount(callerId, accountId);

            List<TransactionView> history = transactionLog.findByAccountId(accountId).stream()
                .map(transaction -> new TransactionView(transaction, account.getAccountType()))
                .toList();

            log.debug("Loaded {} transactions for account {}", history.size(), accountId);
            return history;
        } finally {
            metrics.recordLatency("list_transactions", System.currentTimeMillis() - startTime);
        }
    }
}
