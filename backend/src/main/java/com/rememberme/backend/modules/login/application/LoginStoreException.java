package com.rememberme.backend.modules.login.application;

import com.rememberme.backend.global.error.RememberMeException;

/**
 * Integrity fault of a login store backend. Never retried: it points at a deployment or
 * schema problem.
 */
public class LoginStoreException extends RememberMeException {

    public enum Reason {
        TABLE_NOT_INITIALIZED("The login table does not exist. Run the login table setup (Flyway migration or LoginTableManager.setup()) first."),
        INVALID_TABLE_FORMAT("The login table exists but its columns do not match the expected login format."),
        TABLE_EXISTS("A table with the login table name already exists with different columns."),
        STORE_FAILURE("The login store failed to complete the operation.");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public LoginStoreException(Reason reason) {
        this(reason, null);
    }

    public LoginStoreException(Reason reason, Throwable cause) {
        super("LOGIN_STORE_" + reason.name(), reason.message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
