package com.rememberme.backend.modules.login.infrastructure.persistence;

import static com.rememberme.backend.support.JpaLoginStoreTestConfig.NOW;
import static com.rememberme.backend.support.Logins.login;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.support.JpaLoginStoreTestConfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
@ActiveProfiles("test")
@Import(JpaLoginStoreTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class LoginTableManagerTest {

    @Autowired
    LoginTableManager tableManager;

    @Autowired
    JpaLoginStore store;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @AfterEach
    void restoreTable() {
        tableManager.drop();
        tableManager.setup();
    }

    @Test
    void setupIsIdempotent() {
        tableManager.setup();
        tableManager.setup();

        assertThat(tableManager.exists()).isTrue();
        assertThat(tableManager.hasExpectedColumns()).isTrue();
    }

    @Test
    void clearRemovesAllRows() {
        store.put(login("user", "s1", "t1", "a", NOW));
        store.put(login("other", "s2", "t2", "b", NOW));

        tableManager.clear();

        assertThat(store.listUserLogins("user")).isEmpty();
        assertThat(store.listUserLogins("other")).isEmpty();
    }

    @Test
    void dropAndClearTolerateMissingTable() {
        tableManager.drop();
        tableManager.drop();
        tableManager.clear();

        assertThat(tableManager.exists()).isFalse();
    }

    @Test
    void missingTableIsReportedAsNotInitialized() {
        tableManager.drop();

        assertThatThrownBy(() -> store.get("user", "s1"))
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(LoginStoreException.Reason.TABLE_NOT_INITIALIZED));
        assertThatThrownBy(() -> store.put(login("user", "s1", "t1", "a", NOW)))
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("LOGIN_STORE_TABLE_NOT_INITIALIZED"));
    }

    @Test
    void foreignTableIsReportedAsInvalidFormatOnWrite() {
        replaceWithForeignTable();

        assertThatThrownBy(() -> store.put(login("user", "s1", "t1", "a", NOW)))
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(LoginStoreException.Reason.INVALID_TABLE_FORMAT));
    }

    @Test
    void setupRefusesForeignTable() {
        replaceWithForeignTable();

        assertThatThrownBy(() -> tableManager.setup())
                .isInstanceOfSatisfying(LoginStoreException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(LoginStoreException.Reason.TABLE_EXISTS));
    }

    private void replaceWithForeignTable() {
        tableManager.drop();
        jdbcTemplate.execute("create table persistent_login (id uuid primary key, name varchar(32))");
    }
}
