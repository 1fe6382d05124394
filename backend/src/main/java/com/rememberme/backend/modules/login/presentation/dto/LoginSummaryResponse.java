package com.rememberme.backend.modules.login.presentation.dto;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.rememberme.backend.modules.login.domain.Login;

/**
 * One device of the current user. The token is never exposed.
 */
public record LoginSummaryResponse(
        String serial,
        OffsetDateTime createdAt,
        OffsetDateTime lastLogin,
        String lastIp,
        String lastUseragent,
        boolean current
) {

    public static LoginSummaryResponse from(Login login, boolean current) {
        return new LoginSummaryResponse(
                login.serial(),
                OffsetDateTime.ofInstant(login.createdAt(), ZoneOffset.UTC),
                OffsetDateTime.ofInstant(login.lastLogin(), ZoneOffset.UTC),
                login.lastIp(),
                login.lastUseragent(),
                current
        );
    }
}
