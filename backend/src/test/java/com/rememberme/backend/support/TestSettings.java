package com.rememberme.backend.support;

import com.rememberme.backend.global.config.RememberMeProperties;
import com.rememberme.backend.global.config.RememberMeSettings;

public final class TestSettings {

    public static final String STORE_NAME = "test-login-store";

    private TestSettings() {
    }

    public static RememberMeProperties memoryProperties() {
        RememberMeProperties properties = new RememberMeProperties();
        properties.getStore().setBackend("memory");
        properties.getStore().getMemory().setName(STORE_NAME);
        return properties;
    }

    public static RememberMeSettings memory() {
        return RememberMeSettings.from(memoryProperties());
    }
}
