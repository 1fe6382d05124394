package com.rememberme.backend.modules.login.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One persistent login: a serial lineage for a single device/browser and the token
 * expected on its next cookie authentication.
 *
 * @param username      owner of the login
 * @param serial        stable identifier of the lineage
 * @param token         single-use credential for the next authentication
 * @param sid           session id currently bound to this login
 * @param createdAt     first registration of the serial
 * @param lastLogin     most recent registration or successful authentication
 * @param lastIp        client address seen on the last authentication
 * @param lastUseragent user agent seen on the last authentication
 */
public record Login(
        String username,
        String serial,
        String token,
        String sid,
        Instant createdAt,
        Instant lastLogin,
        String lastIp,
        String lastUseragent
) {

    public Login {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(serial, "serial");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastLogin, "lastLogin");
    }

    /**
     * Returns the login after a successful cookie authentication. The serial, the owner and the
     * creation time are kept; {@code lastLogin} never moves backwards.
     */
    public Login rotate(String newToken, String newSid, Instant now, String ip, String useragent) {
        Instant nextLogin = now.isBefore(lastLogin) ? lastLogin : now;
        return new Login(username, serial, newToken, newSid, createdAt, nextLogin, ip, useragent);
    }

    public boolean lastLoginBefore(Instant cutoff) {
        return lastLogin.isBefore(cutoff);
    }

    @Override
    public String toString() {
        // token stays out of logs
        return "Login[username=" + username + ", serial=" + abbreviate(serial) + ", sid=" + sid
                + ", lastLogin=" + lastLogin + "]";
    }

    static String abbreviate(String value) {
        return value.length() <= 8 ? value : value.substring(0, 8) + "...";
    }
}
