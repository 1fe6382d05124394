package com.rememberme.backend.global.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

/**
 * application.yml: {@code rememberme.*}. Read once at startup through {@link RememberMeSettings#from}.
 */
@ConfigurationProperties(prefix = "rememberme")
public class RememberMeProperties {

    private final Store store = new Store();

    /** Name of the authentication cookie. */
    private String authCookie = "remember_me";

    /** Name of the cookie carrying the session id. */
    private String sessionCookie = "JSESSIONID";

    /** Lifetime of the authentication cookie and max idle age of a login. Plain numbers are seconds. */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cookieMaxAge = Duration.ofDays(90);

    private boolean secureCookie = false;

    private final Fields fields = new Fields();

    private final Cleaner cleaner = new Cleaner();

    public Store getStore() { return store; }

    public String getAuthCookie() { return authCookie; }
    public void setAuthCookie(String authCookie) { this.authCookie = authCookie; }

    public String getSessionCookie() { return sessionCookie; }
    public void setSessionCookie(String sessionCookie) { this.sessionCookie = sessionCookie; }

    public Duration getCookieMaxAge() { return cookieMaxAge; }
    public void setCookieMaxAge(Duration cookieMaxAge) { this.cookieMaxAge = cookieMaxAge; }

    public boolean isSecureCookie() { return secureCookie; }
    public void setSecureCookie(boolean secureCookie) { this.secureCookie = secureCookie; }

    public Fields getFields() { return fields; }

    public Cleaner getCleaner() { return cleaner; }

    public static class Store {

        /** {@code memory} or {@code jpa}. */
        private String backend;

        private int timeoutSeconds = 5;

        private final Memory memory = new Memory();

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public Memory getMemory() { return memory; }
    }

    public static class Memory {

        /** Name of the thread owning the in-memory logins. */
        private String name;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }

    public static class Fields {

        /** Session attribute holding the logged-in user. */
        private String currentUser = "current_user";

        /** Field of the current user holding its username. */
        private String username = "username";

        /** Session attribute flagging an authenticated session. */
        private String authenticated = "authenticated";

        public String getCurrentUser() { return currentUser; }
        public void setCurrentUser(String currentUser) { this.currentUser = currentUser; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getAuthenticated() { return authenticated; }
        public void setAuthenticated(String authenticated) { this.authenticated = authenticated; }
    }

    public static class Cleaner {

        private boolean enabled = true;

        /** Delay between two sweeps; @Scheduled reads the same key. */
        private Duration period = Duration.ofHours(24);

        private Duration initialDelay = Duration.ofHours(24);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getPeriod() { return period; }
        public void setPeriod(Duration period) { this.period = period; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
    }
}
