package com.scaffold.backend.modules.auth.application.oauth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2Error;

/**
 * GitHub users may hide their email; those fall back to {@code <login>@github.local}.
 */
public class GitHubProfileMapper implements OAuthProfileMapper {

    public static final String PROVIDER = "github";
    static final String PLACEHOLDER_DOMAIN = "@github.local";

    @Override
    public OAuthProfile map(Map<String, Object> attributes) {
        String id = OAuthAttributes.string(attributes, "id");
        String login = OAuthAttributes.string(attributes, "login");
        if (id == null || login == null) {
            throw new OAuth2AuthenticationException(
                    new OAuth2Error("invalid_user_info", "GitHub profile is missing id or login", null));
        }

        String email = firstEmail(attributes);
        if (email == null) {
            email = login + PLACEHOLDER_DOMAIN;
        }
        String name = OAuthAttributes.string(attributes, "name");

        Map<String, Object> profileData = new LinkedHashMap<>();
        profileData.put("login", login);
        Object avatar = attributes.get("avatar_url");
        if (avatar != null) {
            profileData.put("avatarUrl", avatar);
        }
        profileData.put("attributes", OAuthAttributes.withoutSecrets(attributes));

        return new OAuthProfile(PROVIDER, id, email, name != null ? name : login, profileData);
    }

    private static String firstEmail(Map<String, Object> attributes) {
        Object emails = attributes.get("emails");
        if (emails instanceof List<?> list) {
            for (Object entry : list) {
                Object value = entry instanceof Map<?, ?> map ? map.get("value") : entry;
                if (value != null && !value.toString().isBlank()) {
                    return value.toString();
                }
            }
        }
        return OAuthAttributes.string(attributes, "email");
    }
}
