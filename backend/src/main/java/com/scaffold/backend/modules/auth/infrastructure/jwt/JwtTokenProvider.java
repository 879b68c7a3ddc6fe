package com.scaffold.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import com.scaffold.backend.global.config.InvalidConfigurationException;
import com.scaffold.backend.modules.auth.application.AuthProperties;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.springframework.stereotype.Component;

/**
 * HMAC key for access tokens. A secret prefixed with {@code base64:} is decoded, anything
 * else is used as UTF-8 bytes.
 */
@Component
public class JwtTokenProvider {

    private static final String BASE64_PREFIX = "base64:";

    private final SecretKey secretKey;

    public JwtTokenProvider(AuthProperties properties) {
        this.secretKey = toKey(properties.jwtSecret());
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    static SecretKey toKey(String secret) {
        byte[] keyBytes;
        if (secret.startsWith(BASE64_PREFIX)) {
            try {
                keyBytes = Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
            } catch (IllegalArgumentException | DecodingException ex) {
                throw new InvalidConfigurationException("app.auth.jwt-secret is not valid Base64", ex);
            }
        } else {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Keys.hmacShaKeyFor(keyBytes);
        } catch (WeakKeyException ex) {
            throw new InvalidConfigurationException("app.auth.jwt-secret must be at least 256 bits", ex);
        }
    }
}
