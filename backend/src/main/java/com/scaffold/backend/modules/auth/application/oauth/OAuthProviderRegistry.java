package com.scaffold.backend.modules.auth.application.oauth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.scaffold.backend.modules.auth.application.AuthProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.config.oauth2.client.CommonOAuth2Provider;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.stereotype.Component;

/**
 * Third-party login providers that have credentials configured. Providers without a client
 * id and secret are left out entirely.
 */
@Component
public class OAuthProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(OAuthProviderRegistry.class);

    private final Map<String, OAuthProvider> providers;

    public OAuthProviderRegistry(AuthProperties properties) {
        Map<String, OAuthProvider> registered = new LinkedHashMap<>();
        properties.oauth().providers().forEach((name, settings) -> {
            if (settings == null || !settings.hasCredentials()) {
                log.info("OAuth provider {} has no credentials and is disabled", name);
                return;
            }
            Optional<OAuthProvider> provider = build(name, settings);
            if (provider.isEmpty()) {
                log.warn("Ignoring unsupported OAuth provider {}", name);
                return;
            }
            registered.put(name, provider.get());
            log.info("OAuth provider {} registered", name);
        });
        this.providers = Collections.unmodifiableMap(registered);
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public Optional<OAuthProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public List<String> names() {
        return List.copyOf(providers.keySet());
    }

    public List<ClientRegistration> clientRegistrations() {
        return providers.values().stream().map(OAuthProvider::registration).toList();
    }

    private static Optional<OAuthProvider> build(String name, AuthProperties.Provider settings) {
        return switch (name) {
            case GoogleProfileMapper.PROVIDER -> Optional.of(new OAuthProvider(
                    name,
                    registration(CommonOAuth2Provider.GOOGLE.getBuilder(name), settings)
                            .scope("openid", "email", "profile")
                            .build(),
                    new GoogleProfileMapper()
            ));
            case GitHubProfileMapper.PROVIDER -> Optional.of(new OAuthProvider(
                    name,
                    registration(CommonOAuth2Provider.GITHUB.getBuilder(name), settings)
                            .scope("read:user", "user:email")
                            .build(),
                    new GitHubProfileMapper()
            ));
            default -> Optional.empty();
        };
    }

    private static ClientRegistration.Builder registration(ClientRegistration.Builder builder, AuthProperties.Provider settings) {
        builder.clientId(settings.clientId()).clientSecret(settings.clientSecret());
        if (settings.redirectUri() != null && !settings.redirectUri().isBlank()) {
            builder.redirectUri(settings.redirectUri());
        }
        return builder;
    }
}
