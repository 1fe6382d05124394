package com.rememberme.backend.modules.login.application;

import com.rememberme.backend.global.config.RememberMeSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes logins not used within the cookie max-age, with their sessions.
 */
@Component
@ConditionalOnProperty(prefix = "rememberme.cleaner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LoginCleaner {

    private static final Logger log = LoggerFactory.getLogger(LoginCleaner.class);

    private final Authenticator authenticator;
    private final RememberMeSettings settings;

    public LoginCleaner(Authenticator authenticator, RememberMeSettings settings) {
        this.authenticator = authenticator;
        this.settings = settings;
    }

    @Scheduled(
            initialDelayString = "${rememberme.cleaner.initial-delay:PT24H}",
            fixedDelayString = "${rememberme.cleaner.period:PT24H}"
    )
    public void cleanOldLogins() {
        try {
            int removed = authenticator.cleanOldLogins(settings.cookieMaxAge());
            if (removed > 0) {
                log.info("Removed {} expired persistent login(s)", removed);
            }
        } catch (RuntimeException ex) {
            log.warn("Persistent login cleanup failed; retrying on the next run", ex);
        }
    }
}
