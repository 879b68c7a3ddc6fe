package com.scaffold.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RevokedSessionsResponse(UUID userId, int revoked) {
}
