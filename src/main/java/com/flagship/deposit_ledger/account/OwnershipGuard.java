package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.exception.AccountNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Confirms that a caller owns an account before it is read or funded.
 *
 * A missing account and an account owned by someone else produce the same
 * {@link AccountNotFoundException}; the lookup is a single query filtered on both
 * columns, so the two cases are not even distinguished internally.
 */
@Component
@Slf4j
public class OwnershipGuard {

    private final AccountStore accountStore;

    public OwnershipGuard(AccountStore accountStore) {
        this.accountStore = accountStore;
    }

    public Account requireOwnedAccount(long callerId, long accountId) {
        return accountStore.findByIdAndOwner(accountId, callerId)
            .orElseThrow(() -> {
                log.info("Account {} not found for caller {}", accountId, callerId);
                return new AccountNotFoundException();
            });
    }
}
