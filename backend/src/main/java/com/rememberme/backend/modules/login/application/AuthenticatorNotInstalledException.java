package com.rememberme.backend.modules.login.application;

import com.rememberme.backend.global.error.RememberMeException;

/**
 * The authenticator was called for a request that did not pass through the remember-me filter.
 */
public class AuthenticatorNotInstalledException extends RememberMeException {

    public AuthenticatorNotInstalledException() {
        super("AUTHENTICATOR_NOT_INSTALLED",
                "The remember-me filter has not processed this request. Register RememberMeFilter in the security filter chain.");
    }
}
