package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.exception.AccountConflictException;
import com.flagship.deposit_ledger.exception.InternalFailureException;
import com.flagship.deposit_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    private static final long OWNER = 42L;

    @Mock
    private AccountStore accountStore;

    @Mock
    private AccountNumberGenerator accountNumberGenerator;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        accountService = new AccountService(accountStore, accountNumberGenerator,
            new OwnershipGuard(accountStore), new LedgerMetrics(new SimpleMeterRegistry()), transactionManager);
    }

    @Test
    @DisplayName("New account is returned as read back from the store")
    void opensAccount() {
        Account stored = new Account(3L, "0000012345", OWNER, AccountType.SAVINGS,
            new BigDecimal("0.00"), AccountStatus.ACTIVE, Instant.now());
        when(accountStore.existsByOwnerAndType(OWNER, AccountType.SAVINGS)).thenReturn(false);
        when(accountNumberGenerator.generate()).thenReturn("0000012345");
        when(accountStore.insert(OWNER, "0000012345", AccountType.SAVINGS)).thenReturn(3L);
        when(accountStore.findById(3L)).thenReturn(Optional.of(stored));

        Account account = accountService.openAccount(OWNER, AccountType.SAVINGS);

        assertSame(stored, account);
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("Second account of the same type is a conflict")
    void duplicateType() {
        when(accountStore.existsByOwnerAndType(OWNER, AccountType.CHECKING)).thenReturn(true);

        AccountConflictException exception = assertThrows(AccountConflictException.class,
            () -> accountService.openAccount(OWNER, AccountType.CHECKING));

        assertEquals("You already have a checking account", exception.getMessage());
        verify(accountNumberGenerator, never()).generate();
        verify(accountStore, never()).insert(anyLong(), anyString(), any());
    }

    @Test
    @DisplayName("Losing a concurrent open race on the owner/type constraint is a conflict")
    void concurrentOpenRace() {
        when(accountStore.existsByOwnerAndType(OWNER, AccountType.CHECKING)).thenReturn(false);
        when(accountNumberGenerator.generate()).thenReturn("0000000001");
        when(accountStore.insert(OWNER, "0000000001", AccountType.CHECKING)).thenThrow(new DuplicateKeyException(
            "duplicate key", new SQLException(
                "ERROR: duplicate key value violates unique constraint \"uq_accounts_owner_type\"")));

        assertThrows(AccountConflictException.class, () -> accountService.openAccount(OWNER, AccountType.CHECKING));
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("Other duplicate key violations are internal failures")
    void accountNumberRace() {
        when(accountStore.existsByOwnerAndType(OWNER, AccountType.CHECKING)).thenReturn(false);
        when(accountNumberGenerator.generate()).thenReturn("0000000001");
        when(accountStore.insert(OWNER, "0000000001", AccountType.CHECKING)).thenThrow(new DuplicateKeyException(
            "duplicate key", new SQLException(
                "ERROR: duplicate key value violates unique constraint \"uq_accounts_account_number\"")));

        assertThrows(InternalFailureException.class, () -> accountService.openAccount(OWNER, AccountType.CHECKING));
    }

    @Test
    @DisplayName("Failed read-back after insert is an internal failure, never a placeholder account")
    void readBackFailure() {
        when(accountStore.existsByOwnerAndType(OWNER, AccountType.CHECKING)).thenReturn(false);
        when(accountNumberGenerator.generate()).thenReturn("0000000001");
        when(accountStore.insert(OWNER, "0000000001", AccountType.CHECKING)).thenReturn(9L);
        when(accountStore.findById(9L)).thenReturn(Optional.empty());

        InternalFailureException exception = assertThrows(InternalFailureException.class,
            () -> accountService.openAccount(OWNER, AccountType.CHECKING));

        assertTrue(exception.getMessage().contains("could not be retrieved"));
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }
}
