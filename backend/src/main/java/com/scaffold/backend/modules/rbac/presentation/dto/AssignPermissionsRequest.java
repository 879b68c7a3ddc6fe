package com.scaffold.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record AssignPermissionsRequest(
        @NotNull(message = "permissionIds is required") List<@NotNull UUID> permissionIds
) {
}
