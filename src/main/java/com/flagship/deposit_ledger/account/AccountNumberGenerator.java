package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.config.LedgerProperties;
import com.flagship.deposit_ledger.exception.AccountNumberExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Produces external 10-digit account numbers.
 *
 * Numbers come from {@link SecureRandom} so they cannot be guessed from a
 * previously issued one. Each candidate is checked against the store and
 * redrawn on collision, up to {@code ledger.account-number.max-attempts} draws.
 * The unique constraint on {@code accounts.account_number} still guards the insert.
 */
@Component
@Slf4j
public class AccountNumberGenerator {

    static final long MODULUS = 1_000_000_000L;
    static final int WIDTH = 10;

    private final AccountStore accountStore;
    private final Random random;
    private final int maxAttempts;

    @Autowired
    public AccountNumberGenerator(AccountStore accountStore, LedgerProperties properties) {
        this(accountStore, new SecureRandom(), properties.getAccountNumber().getMaxAttempts());
    }

    AccountNumberGenerator(AccountStore accountStore, Random random, int maxAttempts) {
        this.accountStore = accountStore;
        this.random = random;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Returns an account number not yet present in the store.
     *
     * @throws AccountNumberExhaustedException if every attempt collided
     */
    public String generate() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = draw();
            if (!accountStore.existsByAccountNumber(candidate)) {
                return candidate;
            }
            log.warn("Account number collision on attempt {}/{}", attempt, maxAttempts);
        }
        throw new AccountNumberExhaustedException(maxAttempts);
    }

    String draw() {
        long value = Math.floorMod(random.nextLong(), MODULUS);
        return String.format("%0" + WIDTH + "d", value);
    }
}
