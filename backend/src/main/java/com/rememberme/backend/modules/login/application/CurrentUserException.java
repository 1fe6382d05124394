package com.rememberme.backend.modules.login.application;

import com.rememberme.backend.global.error.RememberMeException;

/**
 * No current user principal in the session when registering a login.
 */
public class CurrentUserException extends RememberMeException {

    public CurrentUserException(String currentUserKey) {
        super("NO_CURRENT_USER", "There is no currently logged-in user. The session must contain a '"
                + currentUserKey + "' attribute before registering a login.");
    }
}
