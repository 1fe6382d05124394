package com.rememberme.backend.modules.login.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rememberme.backend.modules.login.domain.LoginEntity;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoginEntityRepository extends JpaRepository<LoginEntity, UUID> {

    List<LoginEntity> findByUsername(String username);

    Optional<LoginEntity> findByUsernameAndSerial(String username, String serial);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from LoginEntity l where l.username = :username and l.serial = :serial")
    Optional<LoginEntity> findForUpdate(@Param("username") String username, @Param("serial") String serial);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from LoginEntity l where l.username = :username and l.serial = :serial")
    int deleteByKey(@Param("username") String username, @Param("serial") String serial);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from LoginEntity l where l.lastLogin < :cutoff")
    List<LoginEntity> findLastLoginBeforeForUpdate(@Param("cutoff") OffsetDateTime cutoff);
}
