package com.scaffold.backend.modules.auth.application.oauth;

import java.util.Map;

@FunctionalInterface
public interface OAuthProfileMapper {

    OAuthProfile map(Map<String, Object> attributes);
}
