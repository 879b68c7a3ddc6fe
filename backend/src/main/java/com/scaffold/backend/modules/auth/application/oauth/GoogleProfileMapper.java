package com.scaffold.backend.modules.auth.application.oauth;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2Error;

public class GoogleProfileMapper implements OAuthProfileMapper {

    public static final String PROVIDER = "google";

    @Override
    public OAuthProfile map(Map<String, Object> attributes) {
        String subject = OAuthAttributes.string(attributes, "sub");
        String email = OAuthAttributes.string(attributes, "email");
        if (subject == null || email == null) {
            throw new OAuth2AuthenticationException(
                    new OAuth2Error("invalid_user_info", "Google profile is missing sub or email", null));
        }

        Map<String, Object> profileData = new LinkedHashMap<>();
        putIfPresent(profileData, "picture", attributes.get("picture"));
        putIfPresent(profileData, "emailVerified", attributes.get("email_verified"));
        profileData.put("attributes", OAuthAttributes.withoutSecrets(attributes));

        return new OAuthProfile(PROVIDER, subject, email, OAuthAttributes.string(attributes, "name"), profileData);
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
