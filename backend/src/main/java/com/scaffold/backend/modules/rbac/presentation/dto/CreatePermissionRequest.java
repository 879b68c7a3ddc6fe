package com.scaffold.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "resource is required")
        @Pattern(regexp = "^[^:\\s]+$", message = "resource must not contain ':' or whitespace")
        @Size(max = 64) String resource,
        @NotBlank(message = "action is required")
        @Pattern(regexp = "^[^:\\s]+$", message = "action must not contain ':' or whitespace")
        @Size(max = 64) String action,
        @Size(max = 255) String description
) {
}
