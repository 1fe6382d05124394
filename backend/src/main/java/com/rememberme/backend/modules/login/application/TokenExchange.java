package com.rememberme.backend.modules.login.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import com.rememberme.backend.modules.login.domain.Login;

/**
 * Outcome of {@link LoginStore#exchangeToken}. On {@code MATCHED} the login is the rotated one
 * now in the store; on {@code MISMATCHED} it is the unchanged stored login.
 */
public record TokenExchange(Status status, Login login) {

    public enum Status {
        NO_LOGIN,
        MATCHED,
        MISMATCHED
    }

    public static TokenExchange noLogin() {
        return new TokenExchange(Status.NO_LOGIN, null);
    }

    public static TokenExchange matched(Login rotated) {
        return new TokenExchange(Status.MATCHED, rotated);
    }

    public static TokenExchange mismatched(Login current) {
        return new TokenExchange(Status.MISMATCHED, current);
    }

    public Optional<Login> loginIfPresent() {
        return Optional.ofNullable(login);
    }

    /**
     * Constant-time token comparison shared by the store backends.
     */
    public static boolean tokensMatch(String expected, String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
