package com.rememberme.backend.modules.login.infrastructure.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.rememberme.backend.modules.login.application.TokenExchange;
import com.rememberme.backend.modules.login.domain.Login;
import com.rememberme.backend.modules.login.domain.LoginEntity;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * One transaction per login store operation. Exceptions are translated by {@link JpaLoginStore}.
 */
@Component
@Transactional(timeoutString = "${rememberme.store.timeout-seconds:5}")
public class LoginTransactions {

    private final LoginEntityRepository repository;
    private final Clock clock;

    public LoginTransactions(LoginEntityRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true, timeoutString = "${rememberme.store.timeout-seconds:5}")
    public List<Login> listUserLogins(String username) {
        return repository.findByUsername(username).stream()
                .map(LoginEntity::toLogin)
                .toList();
    }

    @Transactional(readOnly = true, timeoutString = "${rememberme.store.timeout-seconds:5}")
    public Optional<Login> get(String username, String serial) {
        return repository.findByUsernameAndSerial(username, serial).map(LoginEntity::toLogin);
    }

    public void put(Login login) {
        Optional<LoginEntity> existing = repository.findForUpdate(login.username(), login.serial());
        if (existing.isPresent()) {
            existing.get().overwrite(login);
            repository.flush();
        } else {
            repository.saveAndFlush(LoginEntity.from(login));
        }
    }

    public void delete(String username, String serial) {
        repository.deleteByKey(username, serial);
    }

    public List<Login> cleanOldLogins(Duration maxAge) {
        OffsetDateTime cutoff = OffsetDateTime.ofInstant(clock.instant().minus(maxAge), ZoneOffset.UTC);
        List<LoginEntity> expired = repository.findLastLoginBeforeForUpdate(cutoff);
        if (expired.isEmpty()) {
            return List.of();
        }
        List<Login> removed = expired.stream().map(LoginEntity::toLogin).toList();
        repository.deleteAllInBatch(expired);
        return removed;
    }

    public TokenExchange exchangeToken(String username, String serial, String presentedToken,
                                       UnaryOperator<Login> rotation) {
        Optional<LoginEntity> locked = repository.findForUpdate(username, serial);
        if (locked.isEmpty()) {
            return TokenExchange.noLogin();
        }
        LoginEntity row = locked.get();
        Login current = row.toLogin();
        if (!TokenExchange.tokensMatch(current.token(), presentedToken)) {
            return TokenExchange.mismatched(current);
        }
        Login rotated = rotation.apply(current);
        // updated in place: a request waiting on the row lock then reads the new token
        row.overwrite(rotated);
        repository.flush();
        return TokenExchange.matched(rotated);
    }
}
