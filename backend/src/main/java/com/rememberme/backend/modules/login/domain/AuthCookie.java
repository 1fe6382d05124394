package com.rememberme.backend.modules.login.domain;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Value of the authentication cookie: {@code base64(username) + "." + serial + "." + token}.
 * Serials and tokens are URL-safe base64 and therefore never contain a dot.
 */
public record AuthCookie(String username, String serial, String token) {

    private static final char SEPARATOR = '.';
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();
    private static final Base64.Decoder STANDARD_DECODER = Base64.getDecoder();

    public static AuthCookie of(Login login) {
        return new AuthCookie(login.username(), login.serial(), login.token());
    }

    public String encode() {
        return ENCODER.encodeToString(username.getBytes(StandardCharsets.UTF_8))
                + SEPARATOR + serial + SEPARATOR + token;
    }

    /**
     * Parses a raw cookie value. Anything but three non-empty fields with a decodable first
     * field yields {@link Optional#empty()}.
     */
    public static Optional<AuthCookie> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.trim().split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                return Optional.empty();
            }
        }

        return decodeUsername(parts[0])
                .filter(username -> !username.isEmpty())
                .map(username -> new AuthCookie(username, parts[1], parts[2]));
    }

    // written URL-safe; cookies from standard base64 encoders are accepted as well
    private static Optional<String> decodeUsername(String field) {
        boolean standard = field.indexOf('+') >= 0 || field.indexOf('/') >= 0;
        try {
            byte[] bytes = (standard ? STANDARD_DECODER : URL_DECODER).decode(field);
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "AuthCookie[username=" + username + ", serial=" + Login.abbreviate(serial) + "]";
    }
}
