package com.rememberme.backend.global.error;

/**
 * Raised at startup when the {@code rememberme.*} configuration is incomplete or invalid.
 */
public class ConfigurationException extends RememberMeException {

    public enum Reason {
        NO_STORE("Login store not configured. Set rememberme.store.backend to 'memory' or 'jpa'."),
        NO_PROCESS_NAME("Owner name not configured for the memory store. Set rememberme.store.memory.name."),
        INVALID_STORE_TIMEOUT("rememberme.store.timeout-seconds must be positive."),
        NO_AUTH_COOKIE("Authentication cookie name not set. Set rememberme.auth-cookie."),
        NO_SESSION_COOKIE("Session cookie name not set. Set rememberme.session-cookie."),
        INVALID_COOKIE_MAX_AGE("rememberme.cookie-max-age must be positive."),
        INVALID_CLEANER_PERIOD("rememberme.cleaner.period must be positive."),
        INVALID_CLEANER_DELAY("rememberme.cleaner.initial-delay must not be negative."),
        INVALID_FIELD_NAME("rememberme.fields.* must not be blank.");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public ConfigurationException(Reason reason) {
        super("CONFIGURATION_" + reason.name(), reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
