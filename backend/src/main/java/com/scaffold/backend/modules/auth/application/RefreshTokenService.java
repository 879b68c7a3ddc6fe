package com.scaffold.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.domain.RefreshToken;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, verifies and revokes opaque refresh tokens. Stored hashes are salted, so lookups
 * verify the raw value against every candidate row.
 */
@Service
@Transactional
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    static final int TOKEN_BYTES = 32;
    private static final int BCRYPT_MAX_INPUT_BYTES = 72;

    private final RefreshTokenRepository refreshTokenRepository;
    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final SecureRandom secureRandom;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public RefreshTokenService(
            RefreshTokenRepository refreshTokenRepository,
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            SecureRandom secureRandom,
            AuthProperties properties,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.secureRandom = secureRandom;
        this.refreshTokenTtl = TokenLifetimeParser.parse(properties.refreshExpiresIn());
        this.clock = clock;
    }

    /**
     * Persists a new token for the user and returns the raw value. The raw value is never stored.
     */
    public String createRefreshToken(UserAccount user, String userAgent, String ipAddress) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        String rawToken = HexFormat.of().formatHex(bytes);

        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(refreshTokenTtl);
        RefreshToken token = new RefreshToken(
                user,
                passwordEncoder.encode(rawToken),
                expiresAt,
                truncate(userAgent, 512),
                truncate(ipAddress, 64)
        );
        refreshTokenRepository.save(token);
        return rawToken;
    }

    /**
     * Resolves a raw token to its active owner with roles and permissions loaded.
     */
    public UserAccount validateRefreshToken(String rawToken) {
        if (!isPlausible(rawToken)) {
            throw invalidRefreshToken();
        }

        List<RefreshToken> candidates = refreshTokenRepository.findUsableTokens(OffsetDateTime.now(clock));
        for (RefreshToken candidate : candidates) {
            if (!passwordEncoder.matches(rawToken, candidate.getTokenHash())) {
                continue;
            }
            // the scan can outlast a short expiry window
            if (candidate.isExpiredAt(OffsetDateTime.now(clock))) {
                throw invalidRefreshToken();
            }
            UserAccount owner = candidate.getUser();
            if (!owner.isActive()) {
                log.debug("Refresh token {} belongs to inactive user {}", candidate.getId(), owner.getId());
                throw invalidRefreshToken();
            }
            return userAccountRepository.findActiveWithRolesById(owner.getId())
                    .orElseThrow(RefreshTokenService::invalidRefreshToken);
        }
        throw invalidRefreshToken();
    }

    /**
     * Revokes the matching token. Unknown or already revoked values are ignored.
     */
    public void revokeRefreshToken(String rawToken) {
        if (!isPlausible(rawToken)) {
            return;
        }
        for (RefreshToken candidate : refreshTokenRepository.findByRevokedFalse()) {
            if (passwordEncoder.matches(rawToken, candidate.getTokenHash())) {
                candidate.revoke();
                return;
            }
        }
    }

    public int revokeAllUserTokens(UUID userId) {
        int revoked = refreshTokenRepository.revokeAllByUserId(userId);
        if (revoked > 0) {
            log.info("Revoked {} refresh tokens for user {}", revoked, userId);
        }
        return revoked;
    }

    public int cleanupExpiredTokens() {
        return refreshTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    private static boolean isPlausible(String rawToken) {
        return rawToken != null
                && !rawToken.isBlank()
                && rawToken.getBytes(StandardCharsets.UTF_8).length <= BCRYPT_MAX_INPUT_BYTES;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static ProblemException invalidRefreshToken() {
        return ProblemException.unauthorized("INVALID_REFRESH_TOKEN", "Invalid refresh token");
    }
}
