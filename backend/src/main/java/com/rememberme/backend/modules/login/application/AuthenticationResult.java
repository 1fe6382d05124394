package com.rememberme.backend.modules.login.application;

import java.util.Optional;

import com.rememberme.backend.modules.login.domain.Login;

/**
 * Outcome of {@link Authenticator#authenticate}. Only {@link Status#SESSION_AUTHENTICATED} and
 * {@link Status#COOKIE_AUTHENTICATED} authenticate the request.
 *
 * @param status      what happened
 * @param currentUser the session's current user when authenticated, otherwise {@code null}
 * @param login       the rotated login after a cookie authentication, otherwise {@code null}
 */
public record AuthenticationResult(Status status, Object currentUser, Login login) {

    public enum Status {
        SESSION_AUTHENTICATED,
        COOKIE_AUTHENTICATED,
        NO_COOKIE,
        INVALID_COOKIE,
        UNKNOWN_LOGIN,
        TOKEN_MISMATCH
    }

    public static AuthenticationResult of(Status status) {
        return new AuthenticationResult(status, null, null);
    }

    public boolean isAuthenticated() {
        return status == Status.SESSION_AUTHENTICATED || status == Status.COOKIE_AUTHENTICATED;
    }

    /**
     * A stale token was presented: every login of the user has been revoked.
     */
    public boolean isCompromised() {
        return status == Status.TOKEN_MISMATCH;
    }

    public Optional<Login> rotatedLogin() {
        return Optional.ofNullable(login);
    }
}
