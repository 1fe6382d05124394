package com.rememberme.backend.modules.login.application;

import java.time.Duration;

import com.rememberme.backend.global.error.RememberMeException;

public class LoginStoreTimeoutException extends RememberMeException {

    public LoginStoreTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("LOGIN_STORE_TIMEOUT", "Login store operation '" + operation + "' did not complete within " + timeout, cause);
    }
}
