package com.rememberme.backend.modules.login.infrastructure.persistence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import com.rememberme.backend.modules.login.application.LoginStore;
import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.modules.login.application.LoginStoreTimeoutException;
import com.rememberme.backend.modules.login.application.TokenExchange;
import com.rememberme.backend.modules.login.domain.Login;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * {@link LoginStore} backed by the {@code persistent_login} table. Each operation runs in its own
 * transaction ({@link LoginTransactions}); the token exchange holds a row lock for the whole
 * compare-and-replace.
 * <p>
 * A missing table surfaces as {@code TABLE_NOT_INITIALIZED}, a table with foreign columns as
 * {@code INVALID_TABLE_FORMAT}.
 */
public class JpaLoginStore implements LoginStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLoginStore.class);

    static final int PUT_ATTEMPTS = 3;

    private final LoginTransactions transactions;
    private final LoginTableManager tableManager;
    private final Duration timeout;

    public JpaLoginStore(LoginTransactions transactions, LoginTableManager tableManager, Duration timeout) {
        this.transactions = transactions;
        this.tableManager = tableManager;
        this.timeout = timeout;
    }

    @Override
    public List<Login> listUserLogins(String username) {
        return translate("list_user_logins", () -> transactions.listUserLogins(username));
    }

    @Override
    public Optional<Login> get(String username, String serial) {
        return translate("get", () -> transactions.get(username, serial));
    }

    /**
     * Upserts {@code login}. When a concurrent first write of the same key wins the insert, the
     * row exists afterwards and the next attempt updates it under lock.
     */
    @Override
    public void put(Login login) {
        translate("put", () -> {
            for (int attempt = 1; ; attempt++) {
                try {
                    transactions.put(login);
                    return null;
                } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
                    if (attempt >= PUT_ATTEMPTS) {
                        throw ex;
                    }
                    log.debug("Concurrent write of {}, retrying (attempt {})", login, attempt + 1);
                }
            }
        });
        log.debug("Stored {}", login);
    }

    @Override
    public void delete(String username, String serial) {
        translate("delete", () -> {
            transactions.delete(username, serial);
            return null;
        });
    }

    @Override
    public List<Login> cleanOldLogins(Duration maxAge) {
        return translate("clean_old_logins", () -> transactions.cleanOldLogins(maxAge));
    }

    @Override
    public TokenExchange exchangeToken(String username, String serial, String presentedToken,
                                       UnaryOperator<Login> rotation) {
        return translate("exchange_token",
                () -> transactions.exchangeToken(username, serial, presentedToken, rotation));
    }

    private <T> T translate(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (TransactionTimedOutException | QueryTimeoutException | PessimisticLockingFailureException ex) {
            // includes lock waits on the login row that ran out
            throw new LoginStoreTimeoutException(operation, timeout, ex);
        } catch (InvalidDataAccessResourceUsageException | DataIntegrityViolationException ex) {
            throw new LoginStoreException(diagnose(), ex);
        } catch (DataAccessException | TransactionException ex) {
            throw new LoginStoreException(LoginStoreException.Reason.STORE_FAILURE, ex);
        }
    }

    private LoginStoreException.Reason diagnose() {
        if (!tableManager.exists()) {
            return LoginStoreException.Reason.TABLE_NOT_INITIALIZED;
        }
        if (!tableManager.hasExpectedColumns()) {
            return LoginStoreException.Reason.INVALID_TABLE_FORMAT;
        }
        return LoginStoreException.Reason.STORE_FAILURE;
    }
}
