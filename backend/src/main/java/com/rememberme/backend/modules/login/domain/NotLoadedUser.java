package com.rememberme.backend.modules.login.domain;

/**
 * Placeholder current user put in the session after a cookie authentication. The host
 * application loads the real user object from {@link #username()} when it needs it.
 */
public record NotLoadedUser(String username) {
}
