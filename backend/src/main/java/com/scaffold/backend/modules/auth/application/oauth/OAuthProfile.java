package com.scaffold.backend.modules.auth.application.oauth;

import java.util.Map;

/**
 * Normalized identity returned by an OAuth provider.
 */
public record OAuthProfile(
        String provider,
        String providerId,
        String email,
        String name,
        Map<String, Object> profileData
) {

    public OAuthProfile {
        profileData = profileData == null ? Map.of() : Map.copyOf(profileData);
    }
}
