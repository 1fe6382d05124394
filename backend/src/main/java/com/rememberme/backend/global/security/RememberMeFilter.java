package com.rememberme.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.rememberme.backend.global.config.RememberMeSettings;
import com.rememberme.backend.global.error.ProblemResponse;
import com.rememberme.backend.global.error.RememberMeException;
import com.rememberme.backend.modules.login.application.AuthenticationResult;
import com.rememberme.backend.modules.login.application.Authenticator;
import com.rememberme.backend.modules.login.application.LoginStoreTimeoutException;
import com.rememberme.backend.modules.login.infrastructure.web.ServletLoginExchange;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Installs the authenticator for the request and runs the remember-me authentication. An
 * authenticated outcome becomes a {@link RememberMePrincipal} in the security context; the raw
 * {@link AuthenticationResult} is left in the {@link #RESULT_ATTRIBUTE} request attribute.
 */
@Component
public class RememberMeFilter extends OncePerRequestFilter {

    public static final String RESULT_ATTRIBUTE = AuthenticationResult.class.getName();

    private static final Logger log = LoggerFactory.getLogger(RememberMeFilter.class);

    private final Authenticator authenticator;
    private final RememberMeSettings settings;
    private final ObjectMapper objectMapper;

    public RememberMeFilter(Authenticator authenticator, RememberMeSettings settings, ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        ServletLoginExchange.install(request);

        AuthenticationResult result;
        try {
            result = authenticator.authenticate(ServletLoginExchange.of(request, response, settings));
        } catch (RememberMeException ex) {
            SecurityContextHolder.clearContext();
            HttpStatus status = ex instanceof LoginStoreTimeoutException
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Remember-me authentication failed: {}", ex.getCode(), ex);
            ProblemWriter.write(objectMapper, response, status, ProblemResponse.of(status, ex, request.getRequestURI()));
            return;
        }
        request.setAttribute(RESULT_ATTRIBUTE, result);

        if (result.isAuthenticated()) {
            authenticator.usernameOf(result.currentUser()).ifPresent(username -> {
                RememberMePrincipal principal = new RememberMePrincipal(username, result.status());
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, List.of());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            });
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/actuator") || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui");
    }
}
