package com.rememberme.backend.modules.login.infrastructure.web;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.rememberme.backend.modules.login.application.SessionStore;

import jakarta.servlet.http.HttpSession;
import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionIdListener;
import jakarta.servlet.http.HttpSessionListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link SessionStore} over the servlet container's sessions. Spring Boot registers this bean as
 * a session listener, so every live session is tracked by id and can be invalidated from any
 * request.
 */
@Component
public class HttpSessionRegistry implements SessionStore, HttpSessionListener, HttpSessionIdListener {

    private static final Logger log = LoggerFactory.getLogger(HttpSessionRegistry.class);

    private final ConcurrentMap<String, HttpSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void sessionCreated(HttpSessionEvent event) {
        HttpSession session = event.getSession();
        sessions.put(session.getId(), session);
    }

    @Override
    public void sessionDestroyed(HttpSessionEvent event) {
        sessions.remove(event.getSession().getId());
    }

    @Override
    public void sessionIdChanged(HttpSessionEvent event, String oldSessionId) {
        sessions.remove(oldSessionId);
        HttpSession session = event.getSession();
        sessions.put(session.getId(), session);
    }

    @Override
    public void delete(String sessionId) {
        if (sessionId == null) {
            return;
        }
        HttpSession session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        try {
            session.invalidate();
        } catch (IllegalStateException ex) {
            log.debug("Session {} was already invalidated", sessionId);
        }
    }

    int size() {
        return sessions.size();
    }
}
