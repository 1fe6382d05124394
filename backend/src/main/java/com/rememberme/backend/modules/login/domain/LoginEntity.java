package com.rememberme.backend.modules.login.domain;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = LoginEntity.TABLE_NAME,
        uniqueConstraints = @UniqueConstraint(name = "uk_persistent_login_username_serial", columnNames = {"username", "serial"}),
        indexes = {
                @Index(name = "idx_persistent_login_serial", columnList = "serial"),
                @Index(name = "idx_persistent_login_last_login", columnList = "last_login")
        }
)
public class LoginEntity {

    public static final String TABLE_NAME = "persistent_login";

    static final int LAST_IP_LENGTH = 64;
    static final int LAST_USERAGENT_LENGTH = 512;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, length = 255)
    private String username;

    @Column(name = "serial", nullable = false, length = 128)
    private String serial;

    @Column(name = "token", nullable = false, length = 128)
    private String token;

    @Column(name = "sid", length = 255)
    private String sid;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_login", nullable = false)
    private OffsetDateTime lastLogin;

    @Column(name = "last_ip", length = LAST_IP_LENGTH)
    private String lastIp;

    @Column(name = "last_useragent", length = LAST_USERAGENT_LENGTH)
    private String lastUseragent;

    protected LoginEntity() {
    }

    public static LoginEntity from(Login login) {
        LoginEntity entity = new LoginEntity();
        entity.username = login.username();
        entity.serial = login.serial();
        entity.token = login.token();
        entity.sid = login.sid();
        entity.createdAt = OffsetDateTime.ofInstant(login.createdAt(), ZoneOffset.UTC);
        entity.lastLogin = OffsetDateTime.ofInstant(login.lastLogin(), ZoneOffset.UTC);
        entity.lastIp = truncate(login.lastIp(), LAST_IP_LENGTH);
        entity.lastUseragent = truncate(login.lastUseragent(), LAST_USERAGENT_LENGTH);
        return entity;
    }

    /**
     * Copies the mutable state of {@code login} onto this row. Username and serial stay.
     */
    public void overwrite(Login login) {
        this.token = login.token();
        this.sid = login.sid();
        this.createdAt = OffsetDateTime.ofInstant(login.createdAt(), ZoneOffset.UTC);
        this.lastLogin = OffsetDateTime.ofInstant(login.lastLogin(), ZoneOffset.UTC);
        this.lastIp = truncate(login.lastIp(), LAST_IP_LENGTH);
        this.lastUseragent = truncate(login.lastUseragent(), LAST_USERAGENT_LENGTH);
    }

    public Login toLogin() {
        return new Login(
                username,
                serial,
                token,
                sid,
                createdAt.toInstant(),
                lastLogin.toInstant(),
                lastIp,
                lastUseragent
        );
    }

    // request metadata is client controlled; keep it within the column
    private static String truncate(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getSerial() {
        return serial;
    }

    public String getToken() {
        return token;
    }

    public String getSid() {
        return sid;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getLastLogin() {
        return lastLogin;
    }

    public String getLastIp() {
        return lastIp;
    }

    public String getLastUseragent() {
        return lastUseragent;
    }
}
