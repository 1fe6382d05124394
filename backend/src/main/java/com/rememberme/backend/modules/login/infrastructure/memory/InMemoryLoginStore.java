package com.rememberme.backend.modules.login.infrastructure.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.rememberme.backend.modules.login.application.LoginStore;
import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.modules.login.application.LoginStoreTimeoutException;
import com.rememberme.backend.modules.login.application.TokenExchange;
import com.rememberme.backend.modules.login.domain.Login;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link LoginStore} owned by a single thread.
 * <p>
 * The index {@code username -> (serial -> login)} is only ever touched by the owner thread;
 * callers submit requests to its mailbox and block until the reply. Requests run one at a time
 * in arrival order, which makes every operation, including {@link #exchangeToken}, linearizable.
 * <p>
 * The timeout bounds the wait in the mailbox. A request still queued when it expires is dropped
 * and never applied; one the owner has already started is awaited, so a caller never reports a
 * failure for a change that took effect. All logins are lost on restart.
 */
public class InMemoryLoginStore implements LoginStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLoginStore.class);

    private final String name;
    private final Duration timeout;
    private final Clock clock;
    private final ExecutorService owner;

    // owner thread only
    private final Map<String, Map<String, Login>> logins = new HashMap<>();

    public InMemoryLoginStore(String name, Duration timeout, Clock clock) {
        this(name, timeout, clock, List.of());
    }

    /**
     * Creates a store pre-filled with {@code initial} logins.
     */
    public InMemoryLoginStore(String name, Duration timeout, Clock clock, List<Login> initial) {
        this.name = name;
        this.timeout = timeout;
        this.clock = clock;
        this.owner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        for (Login login : initial) {
            logins.computeIfAbsent(login.username(), key -> new HashMap<>()).put(login.serial(), login);
        }
        log.warn("Using InMemoryLoginStore '{}' - persistent logins will NOT survive restarts.", name);
    }

    @Override
    public List<Login> listUserLogins(String username) {
        return call("list_user_logins", () -> {
            Map<String, Login> userLogins = logins.get(username);
            return userLogins == null ? List.of() : List.copyOf(userLogins.values());
        });
    }

    @Override
    public Optional<Login> get(String username, String serial) {
        return call("get", () -> Optional.ofNullable(lookup(username, serial)));
    }

    @Override
    public void put(Login login) {
        call("put", () -> {
            logins.computeIfAbsent(login.username(), key -> new HashMap<>()).put(login.serial(), login);
            return null;
        });
        log.debug("Stored {}", login);
    }

    @Override
    public void delete(String username, String serial) {
        call("delete", () -> {
            remove(username, serial);
            return null;
        });
    }

    @Override
    public List<Login> cleanOldLogins(Duration maxAge) {
        return call("clean_old_logins", () -> {
            Instant cutoff = clock.instant().minus(maxAge);
            List<Login> expired = new ArrayList<>();
            Iterator<Map.Entry<String, Map<String, Login>>> users = logins.entrySet().iterator();
            while (users.hasNext()) {
                Map<String, Login> userLogins = users.next().getValue();
                Iterator<Login> serials = userLogins.values().iterator();
                while (serials.hasNext()) {
                    Login login = serials.next();
                    if (login.lastLoginBefore(cutoff)) {
                        expired.add(login);
                        serials.remove();
                    }
                }
                if (userLogins.isEmpty()) {
                    users.remove();
                }
            }
            return List.copyOf(expired);
        });
    }

    @Override
    public TokenExchange exchangeToken(String username, String serial, String presentedToken,
                                       UnaryOperator<Login> rotation) {
        return call("exchange_token", () -> {
            Login current = lookup(username, serial);
            if (current == null) {
                return TokenExchange.noLogin();
            }
            if (!TokenExchange.tokensMatch(current.token(), presentedToken)) {
                return TokenExchange.mismatched(current);
            }
            Login rotated = rotation.apply(current);
            logins.get(username).put(serial, rotated);
            return TokenExchange.matched(rotated);
        });
    }

    /**
     * Removes every login.
     */
    public void clear() {
        call("clear", () -> {
            logins.clear();
            return null;
        });
    }

    @Override
    public void close() {
        owner.shutdownNow();
    }

    private Login lookup(String username, String serial) {
        Map<String, Login> userLogins = logins.get(username);
        return userLogins == null ? null : userLogins.get(serial);
    }

    private void remove(String username, String serial) {
        Map<String, Login> userLogins = logins.get(username);
        if (userLogins == null) {
            return;
        }
        userLogins.remove(serial);
        if (userLogins.isEmpty()) {
            logins.remove(username);
        }
    }

    private <T> T call(String operation, Callable<T> request) {
        AtomicReference<RequestState> state = new AtomicReference<>(RequestState.QUEUED);
        Future<T> reply;
        try {
            reply = owner.submit(() -> state.compareAndSet(RequestState.QUEUED, RequestState.STARTED)
                    ? request.call()
                    : null);
        } catch (RejectedExecutionException ex) {
            throw new LoginStoreException(LoginStoreException.Reason.STORE_FAILURE, ex);
        }

        try {
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            if (state.compareAndSet(RequestState.QUEUED, RequestState.ABANDONED)) {
                reply.cancel(false);
                throw new LoginStoreTimeoutException(operation, timeout, ex);
            }
            // the owner already took the request, so its effect is applied; report it
            return awaitStarted(reply);
        } catch (InterruptedException ex) {
            throw abandon(state, reply, ex);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    private <T> T awaitStarted(Future<T> reply) {
        try {
            return reply.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LoginStoreException(LoginStoreException.Reason.STORE_FAILURE, ex);
        } catch (ExecutionException ex) {
            throw unwrap(ex);
        }
    }

    private static LoginStoreException abandon(AtomicReference<RequestState> state, Future<?> reply,
                                               InterruptedException ex) {
        Thread.currentThread().interrupt();
        if (state.compareAndSet(RequestState.QUEUED, RequestState.ABANDONED)) {
            reply.cancel(false);
        }
        return new LoginStoreException(LoginStoreException.Reason.STORE_FAILURE, ex);
    }

    private static RuntimeException unwrap(ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new LoginStoreException(LoginStoreException.Reason.STORE_FAILURE, cause);
    }

    @Override
    public String toString() {
        return "InMemoryLoginStore[" + name + "]";
    }

    private enum RequestState {
        QUEUED,
        STARTED,
        ABANDONED
    }
}
