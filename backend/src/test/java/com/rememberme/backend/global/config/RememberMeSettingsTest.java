package com.rememberme.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.function.Consumer;

import com.rememberme.backend.global.error.ConfigurationException;
import com.rememberme.backend.support.TestSettings;

import org.junit.jupiter.api.Test;

class RememberMeSettingsTest {

    @Test
    void appliesDefaults() {
        RememberMeSettings settings = TestSettings.memory();

        assertThat(settings.storeBackend()).isEqualTo(RememberMeSettings.StoreBackend.MEMORY);
        assertThat(settings.memoryStoreName()).isEqualTo(TestSettings.STORE_NAME);
        assertThat(settings.storeTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.authCookie()).isEqualTo("remember_me");
        assertThat(settings.sessionCookie()).isEqualTo("JSESSIONID");
        assertThat(settings.cookieMaxAge()).isEqualTo(Duration.ofSeconds(7_776_000));
        assertThat(settings.secureCookie()).isFalse();
        assertThat(settings.currentUserField()).isEqualTo("current_user");
        assertThat(settings.usernameField()).isEqualTo("username");
        assertThat(settings.authenticatedField()).isEqualTo("authenticated");
        assertThat(settings.cleanerPeriod()).isEqualTo(Duration.ofSeconds(86_400));
    }

    @Test
    void backendIsCaseInsensitive() {
        RememberMeSettings settings = build(p -> p.getStore().setBackend("JPA"));

        assertThat(settings.storeBackend()).isEqualTo(RememberMeSettings.StoreBackend.JPA);
    }

    @Test
    void jpaBackendNeedsNoOwnerName() {
        RememberMeSettings settings = build(p -> {
            p.getStore().setBackend("jpa");
            p.getStore().getMemory().setName(null);
        });

        assertThat(settings.storeBackend()).isEqualTo(RememberMeSettings.StoreBackend.JPA);
    }

    @Test
    void rejectsMissingStore() {
        assertReason(p -> p.getStore().setBackend(null), ConfigurationException.Reason.NO_STORE);
        assertReason(p -> p.getStore().setBackend("redis"), ConfigurationException.Reason.NO_STORE);
    }

    @Test
    void memoryStoreNeedsOwnerName() {
        assertReason(p -> p.getStore().getMemory().setName(" "), ConfigurationException.Reason.NO_PROCESS_NAME);
    }

    @Test
    void rejectsNonPositiveCleanerPeriod() {
        assertReason(p -> p.getCleaner().setPeriod(Duration.ZERO), ConfigurationException.Reason.INVALID_CLEANER_PERIOD);
        assertReason(p -> p.getCleaner().setPeriod(Duration.ofSeconds(-1)), ConfigurationException.Reason.INVALID_CLEANER_PERIOD);
    }

    @Test
    void allowsFastFirstCleanerRun() {
        RememberMeSettings settings = build(p -> p.getCleaner().setInitialDelay(Duration.ofMillis(100)));

        assertThat(settings.cleanerInitialDelay()).isEqualTo(Duration.ofMillis(100));
        assertReason(p -> p.getCleaner().setInitialDelay(Duration.ofMillis(-1)), ConfigurationException.Reason.INVALID_CLEANER_DELAY);
    }

    @Test
    void rejectsInvalidCookieSettings() {
        assertReason(p -> p.setAuthCookie(""), ConfigurationException.Reason.NO_AUTH_COOKIE);
        assertReason(p -> p.setSessionCookie(null), ConfigurationException.Reason.NO_SESSION_COOKIE);
        assertReason(p -> p.setCookieMaxAge(Duration.ZERO), ConfigurationException.Reason.INVALID_COOKIE_MAX_AGE);
    }

    @Test
    void rejectsInvalidStoreTimeoutAndFields() {
        assertReason(p -> p.getStore().setTimeoutSeconds(0), ConfigurationException.Reason.INVALID_STORE_TIMEOUT);
        assertReason(p -> p.getFields().setUsername(" "), ConfigurationException.Reason.INVALID_FIELD_NAME);
    }

    @Test
    void errorCodeNamesTheReason() {
        ConfigurationException ex = new ConfigurationException(ConfigurationException.Reason.NO_STORE);

        assertThat(ex.getCode()).isEqualTo("CONFIGURATION_NO_STORE");
        assertThat(ex.getProblemType()).isEqualTo("urn:problem:rememberme:configuration_no_store");
    }

    private static RememberMeSettings build(Consumer<RememberMeProperties> customizer) {
        RememberMeProperties properties = TestSettings.memoryProperties();
        customizer.accept(properties);
        return RememberMeSettings.from(properties);
    }

    private static void assertReason(Consumer<RememberMeProperties> customizer, ConfigurationException.Reason reason) {
        assertThatThrownBy(() -> build(customizer))
                .isInstanceOfSatisfying(ConfigurationException.class, ex -> assertThat(ex.getReason()).isEqualTo(reason));
    }
}
