package com.rememberme.backend.modules.login.presentation;

import com.rememberme.backend.global.config.RememberMeSettings;
import com.rememberme.backend.modules.login.application.Authenticator;
import com.rememberme.backend.modules.login.infrastructure.web.ServletLoginExchange;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final Authenticator authenticator;
    private final RememberMeSettings settings;

    public AuthController(Authenticator authenticator, RememberMeSettings settings) {
        this.authenticator = authenticator;
        this.settings = settings;
    }

    @Operation(summary = "Log out", description = "Forgets this device and clears the session and remember-me cookies. Always succeeds.")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
        authenticator.logout(ServletLoginExchange.of(request, response, settings));
        return ResponseEntity.noContent().build();
    }
}
