package com.scaffold.backend.modules.organization.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateOrganizationRequest(
        @NotBlank(message = "customerId is required")
        @Pattern(regexp = "^[A-Za-z0-9._-]+$", message = "customerId may only contain letters, digits, '.', '_' and '-'")
        @Size(max = 100) String customerId,
        @NotBlank(message = "name is required") @Size(max = 255) String name,
        @Size(max = 2000) String description,
        @Valid ThemePayload theme,
        Boolean isActive
) {
}
