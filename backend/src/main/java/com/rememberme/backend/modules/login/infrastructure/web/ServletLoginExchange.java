package com.rememberme.backend.modules.login.infrastructure.web;

import java.time.Duration;
import java.util.Optional;

import com.rememberme.backend.global.config.RememberMeSettings;
import com.rememberme.backend.modules.login.application.AuthenticatorNotInstalledException;
import com.rememberme.backend.modules.login.application.LoginExchange;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

/**
 * {@link LoginExchange} over the servlet API. Assigns are request attributes; cookies are written
 * as {@code HttpOnly}, {@code SameSite=Lax} and scoped to {@code /}.
 */
public class ServletLoginExchange implements LoginExchange {

    public static final String INSTALLED_ATTRIBUTE = ServletLoginExchange.class.getName() + ".INSTALLED";

    private static final String COOKIE_PATH = "/";
    private static final String SAME_SITE = "Lax";

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final boolean secureCookie;

    private ServletLoginExchange(HttpServletRequest request, HttpServletResponse response, boolean secureCookie) {
        this.request = request;
        this.response = response;
        this.secureCookie = secureCookie;
    }

    /**
     * Marks the request as processed by the remember-me filter.
     */
    public static void install(HttpServletRequest request) {
        request.setAttribute(INSTALLED_ATTRIBUTE, Boolean.TRUE);
    }

    /**
     * @throws AuthenticatorNotInstalledException if {@link #install} was not called for the request
     */
    public static ServletLoginExchange of(HttpServletRequest request, HttpServletResponse response,
                                          RememberMeSettings settings) {
        if (!isInstalled(request)) {
            throw new AuthenticatorNotInstalledException();
        }
        return new ServletLoginExchange(request, response, settings.secureCookie());
    }

    @Override
    public boolean installed() {
        return isInstalled(request);
    }

    @Override
    public Optional<String> cookie(String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        return cookie == null ? Optional.empty() : Optional.ofNullable(cookie.getValue());
    }

    @Override
    public void putCookie(String name, String value, Duration maxAge) {
        writeCookie(name, value, maxAge);
    }

    @Override
    public void deleteCookie(String name) {
        writeCookie(name, "", Duration.ZERO);
    }

    @Override
    public String sessionId() {
        return request.getSession(true).getId();
    }

    @Override
    public Object sessionAttribute(String name) {
        HttpSession session = request.getSession(false);
        return session == null ? null : session.getAttribute(name);
    }

    @Override
    public void putSessionAttribute(String name, Object value) {
        request.getSession(true).setAttribute(name, value);
    }

    @Override
    public String renewSession() {
        invalidateSession();
        return request.getSession(true).getId();
    }

    @Override
    public void invalidateSession() {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
    }

    @Override
    public void assign(String name, Object value) {
        request.setAttribute(name, value);
    }

    @Override
    public Object assigned(String name) {
        return request.getAttribute(name);
    }

    @Override
    public String remoteAddress() {
        return request.getRemoteAddr();
    }

    @Override
    public String userAgent() {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return userAgent != null ? userAgent : "";
    }

    private void writeCookie(String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secureCookie)
                .path(COOKIE_PATH)
                .sameSite(SAME_SITE)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    private static boolean isInstalled(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(INSTALLED_ATTRIBUTE));
    }
}
