package com.rememberme.backend.global.security;

import com.rememberme.backend.modules.login.application.AuthenticationResult;

/**
 * Principal published to the security context for a request authenticated by session or by
 * remember-me cookie.
 */
public record RememberMePrincipal(String username, AuthenticationResult.Status authenticatedBy) {
}
