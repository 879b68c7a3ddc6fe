package com.scaffold.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    /**
     * Hashes are salted, so every candidate has to be verified in memory.
     */
    @Query("""
            select rt
              from RefreshToken rt
              join fetch rt.user
             where rt.revoked = false
               and rt.expiresAt > :now
            """)
    List<RefreshToken> findUsableTokens(@Param("now") OffsetDateTime now);

    List<RefreshToken> findByRevokedFalse();

    List<RefreshToken> findByUserId(UUID userId);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revoked = true
             where rt.user.id = :userId
               and rt.revoked = false
            """)
    int revokeAllByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from RefreshToken rt where rt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
