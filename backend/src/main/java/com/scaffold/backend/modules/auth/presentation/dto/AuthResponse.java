package com.scaffold.backend.modules.auth.presentation.dto;

public record AuthResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        PublicUserResponse user
) {

    public static final String BEARER = "Bearer";

    public static AuthResponse bearer(String accessToken, long expiresIn, String refreshToken, PublicUserResponse user) {
        return new AuthResponse(accessToken, BEARER, expiresIn, refreshToken, user);
    }
}
