package com.rememberme.backend.modules.login.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import com.rememberme.backend.global.config.RememberMeSettings;
import com.rememberme.backend.modules.login.domain.AuthCookie;
import com.rememberme.backend.modules.login.domain.Login;
import com.rememberme.backend.modules.login.domain.NotLoadedUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persistent login protocol: registration, cookie authentication with token rotation, logout
 * and revocation.
 * <p>
 * Every cookie authentication consumes the presented token. Presenting a token that is no
 * longer the current one for its serial means the cookie was copied; all logins of that user
 * are then revoked.
 */
@Service
public class Authenticator {

    /**
     * Request assign set to {@code true} when a stale token was presented.
     */
    public static final String UNEXPECTED_TOKEN = "unexpected_token";

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final LoginStore loginStore;
    private final SessionStore sessionStore;
    private final RememberMeSettings settings;
    private final LoginTokenGenerator tokenGenerator;
    private final Clock clock;

    public Authenticator(
            LoginStore loginStore,
            SessionStore sessionStore,
            RememberMeSettings settings,
            LoginTokenGenerator tokenGenerator,
            Clock clock
    ) {
        this.loginStore = loginStore;
        this.sessionStore = sessionStore;
        this.settings = settings;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
    }

    public Login registerLogin(LoginExchange exchange) {
        return registerLogin(exchange, LoginOptions.defaults());
    }

    /**
     * Creates a new serial for the user currently stored in the session and issues the
     * authentication cookie.
     *
     * @throws CurrentUserException  if the session holds no current user
     * @throws InvalidUserException  if the current user has no username field
     */
    public Login registerLogin(LoginExchange exchange, LoginOptions options) {
        requireInstalled(exchange);

        String currentUserField = options.currentUserField(settings);
        String usernameField = options.usernameField(settings);
        Object currentUser = exchange.sessionAttribute(currentUserField);
        if (currentUser == null) {
            throw new CurrentUserException(currentUserField);
        }
        String username = CurrentUserFields.username(currentUser, usernameField)
                .orElseThrow(() -> new InvalidUserException(currentUserField, usernameField));

        Instant now = now();
        Login login = new Login(
                username,
                tokenGenerator.newSerial(),
                tokenGenerator.newToken(),
                exchange.sessionId(),
                now,
                now,
                exchange.remoteAddress(),
                exchange.userAgent()
        );
        loginStore.put(login);
        exchange.putCookie(settings.authCookie(), AuthCookie.of(login).encode(), options.cookieMaxAge(settings));
        log.info("Registered persistent login {}", login);
        return login;
    }

    public AuthenticationResult authenticate(LoginExchange exchange) {
        requireInstalled(exchange);

        if (Boolean.TRUE.equals(exchange.sessionAttribute(settings.authenticatedField()))) {
            Object currentUser = exchange.sessionAttribute(settings.currentUserField());
            exchange.assign(settings.authenticatedField(), Boolean.TRUE);
            exchange.assign(settings.currentUserField(), currentUser);
            return new AuthenticationResult(AuthenticationResult.Status.SESSION_AUTHENTICATED, currentUser, null);
        }

        Optional<String> rawCookie = exchange.cookie(settings.authCookie());
        if (rawCookie.isEmpty()) {
            return AuthenticationResult.of(AuthenticationResult.Status.NO_COOKIE);
        }

        Optional<AuthCookie> parsed = AuthCookie.parse(rawCookie.get());
        if (parsed.isEmpty()) {
            log.debug("Discarding malformed authentication cookie");
            exchange.deleteCookie(settings.authCookie());
            return AuthenticationResult.of(AuthenticationResult.Status.INVALID_COOKIE);
        }

        AuthCookie cookie = parsed.get();
        Optional<Login> stored = loginStore.get(cookie.username(), cookie.serial());
        if (stored.isEmpty()) {
            log.debug("No login for {}", cookie);
            exchange.deleteCookie(settings.authCookie());
            return AuthenticationResult.of(AuthenticationResult.Status.UNKNOWN_LOGIN);
        }
        if (!TokenExchange.tokensMatch(stored.get().token(), cookie.token())) {
            return revokeCompromised(exchange, cookie);
        }
        return rotate(exchange, cookie, stored.get());
    }

    /**
     * Deletes the login referenced by the authentication cookie together with its session, then
     * removes the cookies. A cookie that resolves to nothing is only removed.
     */
    public void logout(LoginExchange exchange) {
        requireInstalled(exchange);

        Optional<Login> login = exchange.cookie(settings.authCookie())
                .flatMap(AuthCookie::parse)
                .flatMap(cookie -> loginStore.get(cookie.username(), cookie.serial()));
        if (login.isPresent()) {
            Login current = login.get();
            loginStore.delete(current.username(), current.serial());
            sessionStore.delete(current.sid());
            exchange.invalidateSession();
            exchange.deleteCookie(settings.sessionCookie());
            log.info("Logged out {}", current);
        }
        exchange.deleteCookie(settings.authCookie());
    }

    /**
     * Username of a current user as found in the session, using the configured username field.
     */
    public Optional<String> usernameOf(Object currentUser) {
        if (currentUser == null) {
            return Optional.empty();
        }
        if (currentUser instanceof NotLoadedUser notLoaded) {
            return Optional.of(notLoaded.username());
        }
        return CurrentUserFields.username(currentUser, settings.usernameField());
    }

    public List<Login> listUserLogins(String username) {
        return loginStore.listUserLogins(username);
    }

    /**
     * Deletes one login and its session. No-op when the login does not exist.
     */
    public void deleteLogin(String username, String serial) {
        loginStore.get(username, serial).ifPresent(login -> {
            loginStore.delete(username, serial);
            sessionStore.delete(login.sid());
        });
    }

    public void deleteAllUserLogins(String username) {
        for (Login login : loginStore.listUserLogins(username)) {
            loginStore.delete(login.username(), login.serial());
            sessionStore.delete(login.sid());
        }
    }

    /**
     * Deletes the logins of one user that have not been used within the cookie max-age.
     */
    public void cleanOldLogins(String username) {
        Instant cutoff = now().minus(settings.cookieMaxAge());
        for (Login login : loginStore.listUserLogins(username)) {
            if (login.lastLoginBefore(cutoff)) {
                loginStore.delete(login.username(), login.serial());
                sessionStore.delete(login.sid());
                log.debug("Removed expired login {}", login);
            }
        }
    }

    /**
     * Deletes every login, of any user, not used within {@code maxAge}, with their sessions.
     *
     * @return the number of removed logins
     */
    public int cleanOldLogins(Duration maxAge) {
        List<Login> expired = loginStore.cleanOldLogins(maxAge);
        for (Login login : expired) {
            sessionStore.delete(login.sid());
        }
        return expired.size();
    }

    private AuthenticationResult rotate(LoginExchange exchange, AuthCookie cookie, Login previous) {
        String newSid = exchange.renewSession();
        String newToken = tokenGenerator.newToken();
        Instant now = now();
        String ip = exchange.remoteAddress();
        String userAgent = exchange.userAgent();

        TokenExchange result = loginStore.exchangeToken(cookie.username(), cookie.serial(), cookie.token(),
                current -> current.rotate(newToken, newSid, now, ip, userAgent));
        if (result.status() == TokenExchange.Status.NO_LOGIN) {
            exchange.deleteCookie(settings.authCookie());
            return AuthenticationResult.of(AuthenticationResult.Status.UNKNOWN_LOGIN);
        }
        if (result.status() == TokenExchange.Status.MISMATCHED) {
            // another request consumed the same token first
            return revokeCompromised(exchange, cookie);
        }

        Login rotated = result.login();
        sessionStore.delete(previous.sid());

        NotLoadedUser user = new NotLoadedUser(rotated.username());
        exchange.putSessionAttribute(settings.authenticatedField(), Boolean.TRUE);
        exchange.putSessionAttribute(settings.currentUserField(), user);
        exchange.assign(settings.authenticatedField(), Boolean.TRUE);
        exchange.assign(settings.currentUserField(), user);
        exchange.putCookie(settings.authCookie(), AuthCookie.of(rotated).encode(), settings.cookieMaxAge());
        log.debug("Rotated token of {}", rotated);

        cleanOldLogins(rotated.username());
        return new AuthenticationResult(AuthenticationResult.Status.COOKIE_AUTHENTICATED, user, rotated);
    }

    private AuthenticationResult revokeCompromised(LoginExchange exchange, AuthCookie cookie) {
        deleteAllUserLogins(cookie.username());
        exchange.deleteCookie(settings.authCookie());
        exchange.assign(UNEXPECTED_TOKEN, Boolean.TRUE);
        log.warn("Unexpected token presented for {} from {}; revoked all persistent logins of '{}'",
                cookie, exchange.remoteAddress(), cookie.username());
        return AuthenticationResult.of(AuthenticationResult.Status.TOKEN_MISMATCH);
    }

    private void requireInstalled(LoginExchange exchange) {
        if (exchange == null || !exchange.installed()) {
            throw new AuthenticatorNotInstalledException();
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
