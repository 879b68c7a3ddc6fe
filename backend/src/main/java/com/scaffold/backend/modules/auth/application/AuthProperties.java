package com.scaffold.backend.modules.auth.application;

import java.time.Duration;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Authentication settings bound from {@code app.auth.*}.
 *
 * @param jwtSecret              HMAC secret for access tokens, raw or {@code base64:}-prefixed
 * @param jwtExpiresIn           access token lifetime, e.g. {@code 15m}
 * @param refreshExpiresIn       refresh token lifetime, e.g. {@code 30d}
 * @param bcryptStrength         log2 rounds used for password and refresh token hashes
 * @param defaultRole            role granted on registration and first OAuth login, when it exists
 * @param refreshCleanupInterval delay between expired refresh token sweeps
 * @param oauth                  third-party login providers
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @NotBlank String jwtSecret,
        @DefaultValue("15m") @NotBlank String jwtExpiresIn,
        @DefaultValue("30d") @NotBlank String refreshExpiresIn,
        @DefaultValue("10") @Min(4) @Max(31) int bcryptStrength,
        @DefaultValue("user") String defaultRole,
        @DefaultValue("PT1H") Duration refreshCleanupInterval,
        @DefaultValue @Valid OAuth oauth
) {

    public record OAuth(Map<String, Provider> providers) {

        public OAuth {
            providers = providers == null ? Map.of() : Map.copyOf(providers);
        }
    }

    public record Provider(String clientId, String clientSecret, String redirectUri) {

        public boolean hasCredentials() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }
    }
}
