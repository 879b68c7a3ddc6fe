package com.scaffold.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import jakarta.annotation.PostConstruct;

import com.scaffold.backend.modules.auth.application.AuthProperties;
import com.scaffold.backend.modules.auth.application.TokenLifetimeParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Validates authentication settings while the context starts; any problem aborts startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-in-production-change-me-in-production";
    private static final int MIN_SECRET_BYTES = 32;
    private static final int RECOMMENDED_BCRYPT_STRENGTH = 10;

    private final Environment environment;
    private final AuthProperties authProperties;

    public EnvironmentValidator(Environment environment, AuthProperties authProperties) {
        this.environment = environment;
        this.authProperties = authProperties;
    }

    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();

        checkLifetime("app.auth.jwt-expires-in", authProperties.jwtExpiresIn(), problems);
        checkLifetime("app.auth.refresh-expires-in", authProperties.refreshExpiresIn(), problems);

        String secret = authProperties.jwtSecret();
        if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add("app.auth.jwt-secret: must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (PLACEHOLDER_SECRET.equals(secret) && !environment.acceptsProfiles(Profiles.of("local", "test"))) {
            problems.add("app.auth.jwt-secret: replace the placeholder secret");
        }

        if (authProperties.bcryptStrength() < RECOMMENDED_BCRYPT_STRENGTH) {
            log.warn("app.auth.bcrypt-strength={} is below the recommended {}",
                    authProperties.bcryptStrength(), RECOMMENDED_BCRYPT_STRENGTH);
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new InvalidConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Authentication configuration validated (access={}, refresh={})",
                authProperties.jwtExpiresIn(), authProperties.refreshExpiresIn());
    }

    private static void checkLifetime(String key, String value, List<String> problems) {
        try {
            Duration lifetime = TokenLifetimeParser.parse(value);
            if (lifetime.isZero() || lifetime.isNegative()) {
                problems.add(key + ": must be greater than zero");
            }
        } catch (InvalidConfigurationException ex) {
            problems.add(key + ": " + ex.getMessage());
        }
    }
}
