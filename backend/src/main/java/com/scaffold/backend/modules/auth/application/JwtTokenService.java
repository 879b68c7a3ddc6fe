package com.scaffold.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.scaffold.backend.modules.rbac.domain.GrantedPermission;
import com.scaffold.backend.modules.rbac.domain.GrantedRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies access tokens. Claims: {@code sub} (user id), {@code email} and
 * {@code roles}, a list of {@code {id, name, permissions: [{resource, action}]}}.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, AuthProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = TokenLifetimeParser.parse(properties.jwtExpiresIn());
        this.clock = clock;
    }

    public IssuedAccessToken issueAccessToken(UserAccount user) {
        List<GrantedRole> roles = user.getRoles().stream()
                .map(GrantedRole::from)
                .sorted(Comparator.comparing(GrantedRole::name))
                .toList();
        return issueAccessToken(user.getId(), user.getEmail(), roles);
    }

    public IssuedAccessToken issueAccessToken(UUID userId, String email, List<GrantedRole> roles) {
        Instant now = clock.instant();
        Instant expiry = now.plus(accessTokenTtl);

        String token = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLES, roles.stream().map(JwtTokenService::toClaim).toList())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedAccessToken(token, accessTokenTtl.toSeconds());
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(CLAIM_EMAIL, String.class);
            List<GrantedRole> roles = fromClaim(claims.get(CLAIM_ROLES, List.class));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
            Instant expiresAt = claims.getExpiration().toInstant();

            return new ParsedToken(userId, email, roles, issuedAt, expiresAt);
        } catch (JwtException | IllegalArgumentException | NullPointerException | ClassCastException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    private static Map<String, Object> toClaim(GrantedRole role) {
        Map<String, Object> claim = new LinkedHashMap<>();
        claim.put("id", role.id() != null ? role.id().toString() : null);
        claim.put("name", role.name());
        claim.put("permissions", role.permissions().stream()
                .map(permission -> Map.of("resource", permission.resource(), "action", permission.action()))
                .toList());
        return claim;
    }

    private static List<GrantedRole> fromClaim(List<?> rolesClaim) {
        if (rolesClaim == null) {
            return List.of();
        }
        List<GrantedRole> roles = new ArrayList<>();
        for (Object entry : rolesClaim) {
            Map<?, ?> role = (Map<?, ?>) entry;
            Object id = role.get("id");
            List<GrantedPermission> permissions = new ArrayList<>();
            Object permissionsClaim = role.get("permissions");
            if (permissionsClaim instanceof List<?> list) {
                for (Object item : list) {
                    Map<?, ?> permission = (Map<?, ?>) item;
                    permissions.add(new GrantedPermission(
                            String.valueOf(permission.get("resource")),
                            String.valueOf(permission.get("action"))
                    ));
                }
            }
            roles.add(new GrantedRole(
                    id != null ? UUID.fromString(id.toString()) : null,
                    String.valueOf(role.get("name")),
                    permissions
            ));
        }
        return roles;
    }

    public record IssuedAccessToken(String token, long expiresInSeconds) {
    }

    public record ParsedToken(UUID userId, String email, List<GrantedRole> roles, Instant issuedAt, Instant expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
