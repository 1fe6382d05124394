package com.rememberme.backend.modules.login.application;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.rememberme.backend.modules.login.domain.Login;

/**
 * Storage abstraction for persistent logins, keyed by {@code (username, serial)}.
 * <p>
 * Implementations must be thread-safe and linearizable per key: once {@link #put} has
 * returned, every later {@link #get} from any thread observes the write.
 * <p>
 * Integrity faults surface as {@link LoginStoreException}; a call that does not complete within
 * the configured timeout surfaces as {@link LoginStoreTimeoutException}.
 */
public interface LoginStore {

    /**
     * Lists every login of the given user, empty if none. Order is not significant.
     */
    List<Login> listUserLogins(String username);

    /**
     * Exact lookup by composite key.
     */
    Optional<Login> get(String username, String serial);

    /**
     * Inserts the login, or replaces the one with the same {@code (username, serial)}. Atomic:
     * no reader ever observes a partially written login.
     */
    void put(Login login);

    /**
     * Removes the login if present. Deleting a missing login is not an error.
     */
    void delete(String username, String serial);

    /**
     * Removes and returns every login, across all users, whose {@code lastLogin} is older than
     * {@code now - maxAge}. The creation time plays no part in the decision.
     */
    List<Login> cleanOldLogins(Duration maxAge);

    /**
     * Compares {@code presentedToken} with the stored token and, on a match, stores
     * {@code rotation.apply(current)}, all as one atomic step: no other write on the same key can
     * interleave between the comparison and the replacement. Of two concurrent presentations of
     * the same token at most one is {@link TokenExchange.Status#MATCHED}.
     */
    TokenExchange exchangeToken(String username, String serial, String presentedToken, UnaryOperator<Login> rotation);
}
