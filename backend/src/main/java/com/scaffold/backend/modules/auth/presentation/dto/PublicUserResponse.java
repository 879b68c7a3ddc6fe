package com.scaffold.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.UserAccount;

public record PublicUserResponse(UUID id, String email, String name, String authProvider) {

    public static PublicUserResponse from(UserAccount user) {
        return new PublicUserResponse(user.getId(), user.getEmail(), user.getName(), user.getAuthProvider());
    }
}
