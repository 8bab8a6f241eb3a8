package com.flagship.deposit_ledger.account;

import com.flagship.deposit_ledger.exception.AccountNumberExhaustedException;
import com.flagship.deposit_ledger.exception.InternalFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountNumberGeneratorTest {

    @Mock
    private AccountStore accountStore;

    @Test
    @DisplayName("Generated numbers are 10 digits")
    void tenDigits() {
        AccountNumberGenerator generator = new AccountNumberGenerator(accountStore, new SecureRandom(), 10);
        for (int i = 0; i < 1_000; i++) {
            assertTrue(generator.draw().matches("^\\d{10}$"));
        }
    }

    @Test
    @DisplayName("Small and negative draws are reduced and zero-padded")
    void zeroPadding() {
        Random fixed = mock(Random.class);
        when(fixed.nextLong()).thenReturn(42L, -1L);
        AccountNumberGenerator generator = new AccountNumberGenerator(accountStore, fixed, 10);

        assertEquals("0000000042", generator.draw());
        assertEquals("0999999999", generator.draw());
    }

    @Test
    @DisplayName("A colliding number is redrawn")
    void retriesOnCollision() {
        Random fixed = mock(Random.class);
        when(fixed.nextLong()).thenReturn(1L, 2L);
        when(accountStore.existsByAccountNumber("0000000001")).thenReturn(true);
        when(accountStore.existsByAccountNumber("0000000002")).thenReturn(false);

        AccountNumberGenerator generator = new AccountNumberGenerator(accountStore, fixed, 10);

        assertEquals("0000000002", generator.generate());
        verify(accountStore, times(2)).existsByAccountNumber(anyString());
    }

    @Test
    @DisplayName("Gives up after the configured number of attempts")
    void boundedRetries() {
        when(accountStore.existsByAccountNumber(anyString())).thenReturn(true);
        AccountNumberGenerator generator = new AccountNumberGenerator(accountStore, new SecureRandom(), 5);

        InternalFailureException exception = assertThrows(AccountNumberExhaustedException.class, generator::generate);

        assertTrue(exception.getMessage().contains("5 attempts"));
        verify(accountStore, times(5)).existsByAccountNumber(anyString());
    }

    @Test
    @DisplayName("Consecutive numbers are not sequential")
    void notPredictable() {
        when(accountStore.existsByAccountNumber(anyString())).thenReturn(false);
        AccountNumberGenerator generator = new AccountNumberGenerator(accountStore, new SecureRandom(), 10);

        Set<String> seen = new HashSet<>();
        long previous = Long.parseLong(generator.generate());
        int sequential = 0;
        for (int i = 0; i < 200; i++) {
            String next = generator.generate();
            seen.add(next);
            long current = Long.parseLong(next);
            if (current == previous + 1) {
                sequential++;
            }
            previous = current;
        }
        assertEquals(0, sequential);
        assertTrue(seen.size() > 195);
    }
}
