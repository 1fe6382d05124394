package com.rememberme.backend.global.config;

import java.time.Duration;
import java.util.Locale;

import com.rememberme.backend.global.error.ConfigurationException;

/**
 * Validated, immutable view of {@link RememberMeProperties}, built once at startup and handed to
 * the store, the authenticator and the cleaner.
 */
public record RememberMeSettings(
        StoreBackend storeBackend,
        String memoryStoreName,
        Duration storeTimeout,
        String authCookie,
        String sessionCookie,
        Duration cookieMaxAge,
        boolean secureCookie,
        String currentUserField,
        String usernameField,
        String authenticatedField,
        Duration cleanerPeriod,
        Duration cleanerInitialDelay
) {

    public enum StoreBackend {
        MEMORY,
        JPA
    }

    /**
     * @throws ConfigurationException on the first missing or invalid setting
     */
    public static RememberMeSettings from(RememberMeProperties properties) {
        StoreBackend backend = parseBackend(properties.getStore().getBackend());

        String memoryName = properties.getStore().getMemory().getName();
        if (backend == StoreBackend.MEMORY && isBlank(memoryName)) {
            throw new ConfigurationException(ConfigurationException.Reason.NO_PROCESS_NAME);
        }
        if (properties.getStore().getTimeoutSeconds() <= 0) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_STORE_TIMEOUT);
        }
        if (isBlank(properties.getAuthCookie())) {
            throw new ConfigurationException(ConfigurationException.Reason.NO_AUTH_COOKIE);
        }
        if (isBlank(properties.getSessionCookie())) {
            throw new ConfigurationException(ConfigurationException.Reason.NO_SESSION_COOKIE);
        }
        if (!isPositive(properties.getCookieMaxAge())) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_COOKIE_MAX_AGE);
        }

        RememberMeProperties.Fields fields = properties.getFields();
        if (isBlank(fields.getCurrentUser()) || isBlank(fields.getUsername()) || isBlank(fields.getAuthenticated())) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_FIELD_NAME);
        }

        RememberMeProperties.Cleaner cleaner = properties.getCleaner();
        if (!isPositive(cleaner.getPeriod())) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_CLEANER_PERIOD);
        }
        if (cleaner.getInitialDelay() == null || cleaner.getInitialDelay().isNegative()) {
            throw new ConfigurationException(ConfigurationException.Reason.INVALID_CLEANER_DELAY);
        }

        return new RememberMeSettings(
                backend,
                memoryName,
                Duration.ofSeconds(properties.getStore().getTimeoutSeconds()),
                properties.getAuthCookie(),
                properties.getSessionCookie(),
                properties.getCookieMaxAge(),
                properties.isSecureCookie(),
                fields.getCurrentUser(),
                fields.getUsername(),
                fields.getAuthenticated(),
                cleaner.getPeriod(),
                cleaner.getInitialDelay()
        );
    }

    private static StoreBackend parseBackend(String value) {
        if (isBlank(value)) {
            throw new ConfigurationException(ConfigurationException.Reason.NO_STORE);
        }
        try {
            return StoreBackend.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ConfigurationException.Reason.NO_STORE);
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
