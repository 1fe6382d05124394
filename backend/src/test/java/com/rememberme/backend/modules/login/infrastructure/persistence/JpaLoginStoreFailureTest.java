package com.rememberme.backend.modules.login.infrastructure.persistence;

import static com.rememberme.backend.support.Logins.login;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.modules.login.application.LoginStoreTimeoutException;
import com.rememberme.backend.modules.login.domain.Login;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
class JpaLoginStoreFailureTest {

    private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");

    @Mock
    LoginTransactions transactions;

    @Mock
    LoginTableManager tableManager;

    private JpaLoginStore store;

    @BeforeEach
    void setUp() {
        store = new JpaLoginStore(transactions, tableManager, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("a put that loses the first insert to a concurrent writer is retried as an update")
    void putRetriesAfterLosingTheInsert() {
        Login login = login("user", "s1", "t1", "a", NOW);
        doThrow(new DataIntegrityViolationException("duplicate key"))
                .doNothing()
                .when(transactions).put(login);

        assertThatCode(() -> store.put(login)).doesNotThrowAnyException();

        verify(transactions, times(2)).put(login);
    }

    @Test
    void putGivesUpAfterBoundedAttempts() {
        Login login = login("user", "s1", "t1", "a", NOW);
        doThrow(new DataIntegrityViolationException("not null")).when(transactions).put(login);
        when(tableManager.exists()).thenReturn(true);
        when(tableManager.hasExpectedColumns()).thenReturn(true);

        assertThatThrownBy(() -> store.put(login))
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(LoginStoreException.Reason.STORE_FAILURE));

        verify(transactions, times(JpaLoginStore.PUT_ATTEMPTS)).put(login);
    }

    @Test
    void lockWaitOnRowIsReportedAsTimeout() {
        when(transactions.exchangeToken(anyString(), anyString(), anyString(), any()))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThatThrownBy(() -> store.exchangeToken("user", "s1", "t1", current -> current))
                .isInstanceOf(LoginStoreTimeoutException.class)
                .hasMessageContaining("exchange_token");
    }

    @Test
    void putThatKeepsMissingTheLockIsReportedAsTimeout() {
        Login login = login("user", "s1", "t1", "a", NOW);
        doThrow(new PessimisticLockingFailureException("lock timeout")).when(transactions).put(login);

        assertThatThrownBy(() -> store.put(login))
                .isInstanceOf(LoginStoreTimeoutException.class)
                .hasMessageContaining("put");
    }

    @Test
    void successfulPutIsNotRepeated() {
        Login login = login("user", "s1", "t1", "a", NOW);
        doNothing().when(transactions).put(login);

        store.put(login);

        verify(transactions, times(1)).put(login);
    }
}
