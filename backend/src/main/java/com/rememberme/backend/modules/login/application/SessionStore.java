package com.rememberme.backend.modules.login.application;

/**
 * Server-side session storage whose ids end up in {@code Login.sid}.
 */
public interface SessionStore {

    /**
     * Destroys the session with the given id. Unknown or {@code null} ids are ignored.
     */
    void delete(String sessionId);
}
