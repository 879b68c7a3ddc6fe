package com.scaffold.backend.modules.auth.application.oauth;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

final class OAuthAttributes {

    private static final Set<String> SECRET_KEYS = Set.of("access_token", "refresh_token", "id_token", "token");

    private OAuthAttributes() {
    }

    static String string(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Map<String, Object> withoutSecrets(Map<String, Object> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (value != null && !SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
