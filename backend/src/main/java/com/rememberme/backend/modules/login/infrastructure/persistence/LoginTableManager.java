package com.rememberme.backend.modules.login.infrastructure.persistence;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.rememberme.backend.modules.login.application.LoginStoreException;
import com.rememberme.backend.modules.login.domain.LoginEntity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;

/**
 * Setup, teardown and inspection of the login table. Every operation is idempotent.
 * <p>
 * Flyway normally creates the table through {@code db/migration/V1__persistent_login.sql};
 * {@link #setup()} applies the same script for deployments that manage the schema by hand.
 */
@Component
public class LoginTableManager {

    private static final Logger log = LoggerFactory.getLogger(LoginTableManager.class);

    static final String SCHEMA_SCRIPT = "db/migration/V1__persistent_login.sql";

    static final Set<String> EXPECTED_COLUMNS = Set.of(
            "id", "username", "serial", "token", "sid",
            "created_at", "last_login", "last_ip", "last_useragent");

    private final JdbcTemplate jdbcTemplate;

    public LoginTableManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates the login table unless it already exists with the expected columns.
     *
     * @throws LoginStoreException with {@code TABLE_EXISTS} if a table of that name has other columns
     */
    public void setup() {
        if (exists()) {
            if (!hasExpectedColumns()) {
                throw new LoginStoreException(LoginStoreException.Reason.TABLE_EXISTS);
            }
            log.debug("Login table '{}' already set up", LoginEntity.TABLE_NAME);
            return;
        }
        jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
            ScriptUtils.executeSqlScript(connection, new ClassPathResource(SCHEMA_SCRIPT));
            return null;
        });
        log.info("Login table '{}' has been set up", LoginEntity.TABLE_NAME);
    }

    /**
     * Removes every login. No-op when the table does not exist.
     */
    public void clear() {
        if (!exists()) {
            return;
        }
        int removed = jdbcTemplate.update("delete from " + LoginEntity.TABLE_NAME);
        log.info("Cleared {} login(s) from '{}'", removed, LoginEntity.TABLE_NAME);
    }

    public void drop() {
        jdbcTemplate.execute("drop table if exists " + LoginEntity.TABLE_NAME);
        log.info("Dropped login table '{}'", LoginEntity.TABLE_NAME);
    }

    public boolean exists() {
        Boolean found = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection ->
                !columns(connection).isEmpty() || tableListed(connection));
        return Boolean.TRUE.equals(found);
    }

    public boolean hasExpectedColumns() {
        Set<String> columns = jdbcTemplate.execute((ConnectionCallback<Set<String>>) this::columns);
        return columns != null && columns.equals(EXPECTED_COLUMNS);
    }

    private boolean tableListed(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        for (String candidate : candidateNames()) {
            try (ResultSet tables = metaData.getTables(null, null, candidate, new String[]{"TABLE"})) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private Set<String> columns(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        Set<String> columns = new TreeSet<>();
        for (String candidate : candidateNames()) {
            try (ResultSet rs = metaData.getColumns(null, null, candidate, null)) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
            if (!columns.isEmpty()) {
                break;
            }
        }
        return columns;
    }

    // Unquoted identifiers are folded to lower case by PostgreSQL and to upper case by H2.
    private static String[] candidateNames() {
        return new String[]{
                LoginEntity.TABLE_NAME.toLowerCase(Locale.ROOT),
                LoginEntity.TABLE_NAME.toUpperCase(Locale.ROOT)
        };
    }
}
