package com.scaffold.backend.support;

import java.time.Duration;
import java.util.Map;

import com.scaffold.backend.modules.auth.application.AuthProperties;

public final class TestAuthProperties {

    public static final String SECRET = "unit-test-secret-unit-test-secret-0123456789";

    private TestAuthProperties() {
    }

    public static AuthProperties defaults() {
        return withLifetimes("15m", "30d");
    }

    public static AuthProperties withLifetimes(String accessLifetime, String refreshLifetime) {
        return new AuthProperties(
                SECRET,
                accessLifetime,
                refreshLifetime,
                4,
                "user",
                Duration.ofHours(1),
                new AuthProperties.OAuth(Map.of())
        );
    }

    public static AuthProperties withProviders(Map<String, AuthProperties.Provider> providers) {
        return new AuthProperties(
                SECRET,
                "15m",
                "30d",
                4,
                "user",
                Duration.ofHours(1),
                new AuthProperties.OAuth(providers)
        );
    }
}
