package com.rememberme.backend.modules.login.application;

import com.rememberme.backend.global.error.RememberMeException;

/**
 * The current user principal exists but carries no usable username field.
 */
public class InvalidUserException extends RememberMeException {

    public InvalidUserException(String currentUserKey, String usernameField) {
        super("INVALID_CURRENT_USER", "The '" + currentUserKey + "' session attribute does not contain a '"
                + usernameField + "' field.");
    }
}
