package com.rememberme.backend.modules.login.infrastructure.memory;

import static com.rememberme.backend.support.Logins.login;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.modules.login.application.LoginStoreTimeoutException;
import com.rememberme.backend.modules.login.application.TokenExchange;
import com.rememberme.backend.modules.login.domain.Login;
import com.rememberme.backend.support.MutableClock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryLoginStoreTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");
    private static final Duration MAX_AGE = Duration.ofSeconds(7_776_000);

    private final MutableClock clock = new MutableClock(NOW);
    private InMemoryLoginStore store = new InMemoryLoginStore("memory-store-test", Duration.ofSeconds(5), clock);

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void putThenGet() {
        Login login = login("user", "s1", "t1", "a", NOW);

        store.put(login);

        assertThat(store.get("user", "s1")).contains(login);
        assertThat(store.get("user", "s2")).isEmpty();
        assertThat(store.get("other", "s1")).isEmpty();
    }

    @Test
    @DisplayName("put replaces the login with the same username and serial")
    void putUpserts() {
        store.put(login("user", "s1", "t1", "a", NOW));
        store.put(login("user", "s1", "t2", "b", NOW));

        assertThat(store.listUserLogins("user"))
                .singleElement()
                .satisfies(login -> assertThat(login.token()).isEqualTo("t2"));
    }

    @Test
    void listsOnlyTheUsersLogins() {
        store.put(login("user", "s1", "t1", "a", NOW));
        store.put(login("user", "s2", "t2", "b", NOW));
        store.put(login("other", "s3", "t3", "c", NOW));

        assertThat(store.listUserLogins("user")).extracting(Login::serial).containsExactlyInAnyOrder("s1", "s2");
        assertThat(store.listUserLogins("nobody")).isEmpty();
    }

    @Test
    void deletingMissingLoginIsNotAnError() {
        store.delete("nobody", "s1");
        store.put(login("user", "s1", "t1", "a", NOW));
        store.delete("user", "s2");

        assertThat(store.listUserLogins("user")).hasSize(1);
    }

    @Test
    void deletingLastSerialForgetsTheUser() {
        store.put(login("user", "s1", "t1", "a", NOW));

        store.delete("user", "s1");

        assertThat(store.get("user", "s1")).isEmpty();
        assertThat(store.listUserLogins("user")).isEmpty();
    }

    @Test
    @DisplayName("clean_old_logins removes only logins whose last use is older than max age")
    void cleansOldLogins() {
        Login recent = login("user", "s1", "t1", "a", NOW.minusSeconds(10));
        Login stale = login("user", "s2", "t2", "b", NOW.minusSeconds(8_000_000));
        store.put(recent);
        store.put(stale);

        List<Login> removed = store.cleanOldLogins(MAX_AGE);

        assertThat(removed).containsExactly(stale);
        assertThat(store.listUserLogins("user")).containsExactly(recent);
    }

    @Test
    void cleaningIgnoresCreationTime() {
        Instant longAgo = NOW.minusSeconds(9_000_000);
        Login oldButActive = new Login("user", "s1", "t1", "a", longAgo, NOW.minusSeconds(60), null, null);
        store.put(oldButActive);

        assertThat(store.cleanOldLogins(MAX_AGE)).isEmpty();
        assertThat(store.get("user", "s1")).contains(oldButActive);
    }

    @Test
    void cleaningSpansAllUsersAndDropsEmptiedUsers() {
        store.put(login("alice", "s1", "t1", "a", NOW.minusSeconds(8_000_000)));
        store.put(login("bob", "s2", "t2", "b", NOW.minusSeconds(8_000_000)));
        store.put(login("bob", "s3", "t3", "c", NOW));

        List<Login> removed = store.cleanOldLogins(MAX_AGE);

        assertThat(removed).extracting(Login::serial).containsExactlyInAnyOrder("s1", "s2");
        assertThat(store.listUserLogins("alice")).isEmpty();
        assertThat(store.listUserLogins("bob")).extracting(Login::serial).containsExactly("s3");
    }

    @Test
    void exchangeRotatesOnMatchingToken() {
        store.put(login("user", "s1", "t1", "a", NOW));

        TokenExchange result = store.exchangeToken("user", "s1", "t1",
                current -> current.rotate("t2", "b", NOW.plusSeconds(5), "10.0.0.9", "Safari"));

        assertThat(result.status()).isEqualTo(TokenExchange.Status.MATCHED);
        assertThat(result.login().token()).isEqualTo("t2");
        assertThat(store.get("user", "s1")).contains(result.login());
    }

    @Test
    void exchangeLeavesStoreUntouchedOnMismatch() {
        Login stored = login("user", "s1", "t2", "b", NOW);
        store.put(stored);

        TokenExchange result = store.exchangeToken("user", "s1", "t1",
                current -> current.rotate("t3", "c", NOW, null, null));

        assertThat(result.status()).isEqualTo(TokenExchange.Status.MISMATCHED);
        assertThat(result.login()).isEqualTo(stored);
        assertThat(store.get("user", "s1")).contains(stored);
    }

    @Test
    void exchangeReportsMissingLogin() {
        TokenExchange result = store.exchangeToken("user", "s1", "t1", current -> current);

        assertThat(result.status()).isEqualTo(TokenExchange.Status.NO_LOGIN);
        assertThat(result.loginIfPresent()).isEmpty();
    }

    @Test
    @DisplayName("of concurrent presentations of one token exactly one wins the rotation")
    void concurrentExchangesRotateOnce() throws Exception {
        store.put(login("user", "s1", "t1", "a", NOW));
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<TokenExchange>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String newToken = "t-" + i;
                Callable<TokenExchange> attempt = () -> {
                    start.await();
                    return store.exchangeToken("user", "s1", "t1",
                            current -> current.rotate(newToken, "sid-" + newToken, NOW, null, null));
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int matched = 0;
            for (Future<TokenExchange> result : results) {
                if (result.get(5, TimeUnit.SECONDS).status() == TokenExchange.Status.MATCHED) {
                    matched++;
                }
            }
            assertThat(matched).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void writesAreVisibleToOtherThreads() throws Exception {
        Login login = login("user", "s1", "t1", "a", NOW);
        store.put(login);

        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            assertThat(reader.submit(() -> store.get("user", "s1")).get(5, TimeUnit.SECONDS)).contains(login);
        } finally {
            reader.shutdownNow();
        }
    }

    @Test
    void clearRemovesEverything() {
        store.put(login("alice", "s1", "t1", "a", NOW));
        store.put(login("bob", "s2", "t2", "b", NOW));

        store.clear();

        assertThat(store.listUserLogins("alice")).isEmpty();
        assertThat(store.listUserLogins("bob")).isEmpty();
    }

    @Test
    void startsFromInitialState() {
        store.close();
        Login seeded = login("user", "s1", "t1", "a", NOW);
        store = new InMemoryLoginStore("seeded-store", Duration.ofSeconds(5), clock, List.of(seeded));

        assertThat(store.get("user", "s1")).contains(seeded);
    }

    @Test
    @DisplayName("a call still queued when its timeout expires fails and is never applied")
    void timedOutCallIsNeverApplied() throws Exception {
        store.close();
        store = new InMemoryLoginStore("slow-store", Duration.ofMillis(100), clock);
        store.put(login("user", "s1", "t1", "a", NOW));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService caller = Executors.newSingleThreadExecutor();

        try {
            Future<TokenExchange> slow = caller.submit(() -> store.exchangeToken("user", "s1", "t1", current -> {
                entered.countDown();
                awaitQuietly(release);
                return current.rotate("t2", "b", NOW, null, null);
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> store.put(login("user", "s1", "t-late", "c", NOW)))
                    .isInstanceOf(LoginStoreTimeoutException.class)
                    .hasMessageContaining("put");

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).status()).isEqualTo(TokenExchange.Status.MATCHED);
            assertThat(store.get("user", "s1")).map(Login::token).contains("t2");
        } finally {
            release.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void closedStoreFails() {
        store.close();

        assertThatThrownBy(() -> store.get("user", "s1"))
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(LoginStoreException.Reason.STORE_FAILURE));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
