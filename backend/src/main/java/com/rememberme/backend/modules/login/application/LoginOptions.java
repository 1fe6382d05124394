package com.rememberme.backend.modules.login.application;

import java.time.Duration;

import com.rememberme.backend.global.config.RememberMeSettings;

/**
 * Per-call overrides for {@link Authenticator#registerLogin(LoginExchange, LoginOptions)}. A
 * {@code null} component falls back to the application settings.
 */
public record LoginOptions(
        Duration cookieMaxAge,
        String currentUserField,
        String usernameField
) {

    private static final LoginOptions DEFAULTS = new LoginOptions(null, null, null);

    public LoginOptions {
        if (cookieMaxAge != null && (cookieMaxAge.isZero() || cookieMaxAge.isNegative())) {
            throw new IllegalArgumentException("cookieMaxAge must be positive");
        }
    }

    public static LoginOptions defaults() {
        return DEFAULTS;
    }

    public LoginOptions withCookieMaxAge(Duration maxAge) {
        return new LoginOptions(maxAge, currentUserField, usernameField);
    }

    public LoginOptions withCurrentUserField(String field) {
        return new LoginOptions(cookieMaxAge, field, usernameField);
    }

    public LoginOptions withUsernameField(String field) {
        return new LoginOptions(cookieMaxAge, currentUserField, field);
    }

    Duration cookieMaxAge(RememberMeSettings settings) {
        return cookieMaxAge != null ? cookieMaxAge : settings.cookieMaxAge();
    }

    String currentUserField(RememberMeSettings settings) {
        return hasText(currentUserField) ? currentUserField : settings.currentUserField();
    }

    String usernameField(RememberMeSettings settings) {
        return hasText(usernameField) ? usernameField : settings.usernameField();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
