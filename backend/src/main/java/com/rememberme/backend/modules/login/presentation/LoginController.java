package com.rememberme.backend.modules.login.presentation;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.rememberme.backend.global.security.SecurityUtils;
import com.rememberme.backend.modules.login.application.Authenticator;
import com.rememberme.backend.modules.login.domain.AuthCookie;
import com.rememberme.backend.modules.login.domain.Login;
import com.rememberme.backend.modules.login.presentation.dto.LoginListResponse;
import com.rememberme.backend.modules.login.presentation.dto.LoginSummaryResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Logins", description = "Persistent logins (remembered devices) of the current user")
public class LoginController {

    private final Authenticator authenticator;

    public LoginController(Authenticator authenticator) {
        this.authenticator = authenticator;
    }

    @Operation(summary = "List remembered devices", description = "Most recently used first. Tokens are never returned.")
    @GetMapping("/logins")
    public ResponseEntity<LoginListResponse> listLogins(
            @CookieValue(name = "${rememberme.auth-cookie:remember_me}", required = false) String authCookie
    ) {
        String username = SecurityUtils.getCurrentUsername();
        Optional<String> currentSerial = Optional.ofNullable(authCookie)
                .flatMap(AuthCookie::parse)
                .map(AuthCookie::serial);

        List<LoginSummaryResponse> items = authenticator.listUserLogins(username).stream()
                .sorted(Comparator.comparing(Login::lastLogin).reversed())
                .map(login -> LoginSummaryResponse.from(login, currentSerial.filter(login.serial()::equals).isPresent()))
                .toList();
        return ResponseEntity.ok(new LoginListResponse(username, items));
    }

    @Operation(summary = "Forget a remembered device", description = "Deletes the login and ends its session. Unknown serials are ignored.")
    @DeleteMapping("/logins/{serial}")
    public ResponseEntity<Void> deleteLogin(
            @Parameter(description = "Serial of the login to revoke") @PathVariable("serial") String serial
    ) {
        authenticator.deleteLogin(SecurityUtils.getCurrentUsername(), serial);
        return ResponseEntity.noContent().build();
    }
}
