package com.rememberme.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;

import com.rememberme.backend.modules.login.application.LoginStore;
import com.rememberme.backend.modules.login.infrastructure.memory.InMemoryLoginStore;
import com.rememberme.backend.modules.login.infrastructure.persistence.JpaLoginStore;
import com.rememberme.backend.modules.login.infrastructure.persistence.LoginTableManager;
import com.rememberme.backend.modules.login.infrastructure.persistence.LoginTransactions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RememberMeProperties.class)
public class RememberMeConfig {

    private static final Logger log = LoggerFactory.getLogger(RememberMeConfig.class);

    @Bean
    public RememberMeSettings rememberMeSettings(RememberMeProperties properties) {
        return RememberMeSettings.from(properties);
    }

    /**
     * Single UTC clock source for login timestamps and expiry.
     */
    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public LoginStore loginStore(
            RememberMeSettings settings,
            Clock clock,
            ObjectProvider<LoginTransactions> transactions,
            ObjectProvider<LoginTableManager> tableManager
    ) {
        log.info("Persistent logins use the {} store", settings.storeBackend());
        return switch (settings.storeBackend()) {
            case MEMORY -> new InMemoryLoginStore(settings.memoryStoreName(), settings.storeTimeout(), clock);
            case JPA -> new JpaLoginStore(
                    transactions.getObject(), tableManager.getObject(), settings.storeTimeout());
        };
    }
}
