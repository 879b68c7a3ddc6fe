package com.scaffold.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record CurrentUserResponse(
        UUID id,
        String email,
        String name,
        String authProvider,
        boolean isActive,
        OffsetDateTime createdAt,
        List<String> roles,
        List<String> permissions
) {
}
