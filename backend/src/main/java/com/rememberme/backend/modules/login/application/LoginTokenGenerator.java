package com.rememberme.backend.modules.login.application;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

/**
 * Generates serials and tokens: 48 random bytes, URL-safe base64 without padding (64 characters).
 */
@Component
public class LoginTokenGenerator {

    static final int RANDOM_BYTES = 48;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random = new SecureRandom();

    public String newSerial() {
        return next();
    }

    public String newToken() {
        return next();
    }

    private String next() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
