package com.rememberme.backend.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.rememberme.backend.modules.login.application.SessionStore;

public class RecordingSessionStore implements SessionStore {

    private final List<String> deleted = new CopyOnWriteArrayList<>();

    @Override
    public void delete(String sessionId) {
        deleted.add(sessionId);
    }

    public List<String> deleted() {
        return List.copyOf(deleted);
    }
}
