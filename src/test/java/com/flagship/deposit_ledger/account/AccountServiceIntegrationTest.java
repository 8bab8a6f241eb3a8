package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.exception.AccountConflictException;
import com.flagship.deposit_ledger.exception.AccountNotFoundException;
import com.flagship.deposit_ledger.exception.InternalFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;

@SpringBootTest
@Testcontainers
class AccountServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private AccountService accountService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @SpyBean
    private AccountStore accountStore;

    private static long newOwner() {
        return ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
    }

    private int accountCount(long owner) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE owner_id = ?", Integer.class, owner);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("New account starts ACTIVE with a zero balance and a 10-digit number")
    void opensAccount() {
        long owner = newOwner();

        Account account = accountService.openAccount(owner, AccountType.CHECKING);

        assertEquals(owner, account.getOwnerId());
        assertEquals(AccountType.CHECKING, account.getAccountType());
        assertEquals(AccountStatus.ACTIVE, account.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(account.getBalance()));
        assertTrue(account.getAccountNumber().matches("^\\d{10}$"));
        assertNotNull(account.getCreatedAt());
    }

    @Test
    @DisplayName("One checking and one savings account per owner")
    void oneOfEachType() {
        long owner = newOwner();
        accountService.openAccount(owner, AccountType.CHECKING);
        accountService.openAccount(owner, AccountType.SAVINGS);

        assertThrows(AccountConflictException.class, () -> accountService.openAccount(owner, AccountType.CHECKING));
        assertThrows(AccountConflictException.class, () -> accountService.openAccount(owner, AccountType.SAVINGS));

        List<Account> accounts = accountService.listAccounts(owner);
        assertEquals(List.of(AccountType.CHECKING, AccountType.SAVINGS),
            accounts.stream().map(Account::getAccountType).toList());
    }

    @Test
    @DisplayName("Concurrent opens of the same type create exactly one account")
    void concurrentOpens() throws Exception {
        long owner = newOwner();
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch startGate = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    try {
                        accountService.openAccount(owner, AccountType.SAVINGS);
                    } catch (AccountConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(attempts - 1, conflicts.get());
        assertEquals(1, accountCount(owner));
    }

    @Test
    @DisplayName("1,000 accounts get 1,000 distinct numbers without a collision failure")
    void identifierUniqueness() {
        Set<String> numbers = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            long owner = newOwner();
            numbers.add(accountService.openAccount(owner, AccountType.CHECKING).getAccountNumber());
            numbers.add(accountService.openAccount(owner, AccountType.SAVINGS).getAccountNumber());
        }

        assertEquals(1_000, numbers.size());
        assertTrue(numbers.stream().allMatch(number -> number.matches("^\\d{10}$")));
    }

    @Test
    @DisplayName("Failed read-back after insert reports InternalFailure and leaves no account behind")
    void readBackFailure() {
        long owner = newOwner();
        doReturn(Optional.empty()).when(accountStore).findById(anyLong());

        InternalFailureException exception = assertThrows(InternalFailureException.class,
            () -> accountService.openAccount(owner, AccountType.CHECKING));

        assertTrue(exception.getMessage().contains("could not be retrieved"));
        assertEquals(0, accountCount(owner));
    }

    @Test
    @DisplayName("getAccount is owner-scoped")
    void getAccountScopedToOwner() {
        long owner = newOwner();
        Account account = accountService.openAccount(owner, AccountType.CHECKING);

        assertEquals(account.getId(), accountService.getAccount(owner, account.getId()).getId());
        assertThrows(AccountNotFoundException.class, () -> accountService.getAccount(owner + 1, account.getId()));
    }
}
