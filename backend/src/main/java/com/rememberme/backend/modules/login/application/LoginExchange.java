package com.rememberme.backend.modules.login.application;

import java.time.Duration;
import java.util.Optional;

/**
 * The slice of a request/response pair the {@link Authenticator} works on: cookies, the server-side
 * session, request-scoped assigns and client metadata.
 */
public interface LoginExchange {

    /**
     * Whether the remember-me filter has processed this request.
     */
    boolean installed();

    Optional<String> cookie(String name);

    void putCookie(String name, String value, Duration maxAge);

    void deleteCookie(String name);

    /**
     * Id of the current session, creating the session if there is none yet.
     */
    String sessionId();

    /**
     * Reads a session attribute without creating a session.
     */
    Object sessionAttribute(String name);

    void putSessionAttribute(String name, Object value);

    /**
     * Replaces the current session with a fresh one and returns the new id. Attributes of the old
     * session are not carried over.
     */
    String renewSession();

    void invalidateSession();

    /**
     * Publishes a value to the rest of the request processing.
     */
    void assign(String name, Object value);

    Object assigned(String name);

    String remoteAddress();

    String userAgent();
}
