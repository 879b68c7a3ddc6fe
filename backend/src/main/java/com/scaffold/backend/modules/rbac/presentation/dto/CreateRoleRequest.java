package com.scaffold.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "name is required") @Size(max = 64) String name,
        @Size(max = 255) String description
) {
}
