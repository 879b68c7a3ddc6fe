package com.scaffold.backend.modules.auth.application.oauth;

import org.springframework.security.oauth2.client.registration.ClientRegistration;

public record OAuthProvider(String name, ClientRegistration registration, OAuthProfileMapper profileMapper) {
}
