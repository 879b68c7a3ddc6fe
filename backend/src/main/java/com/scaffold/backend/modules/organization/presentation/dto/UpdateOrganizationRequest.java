package com.scaffold.backend.modules.organization.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Absent fields keep their current value.
 */
public record UpdateOrganizationRequest(
        @Pattern(regexp = "^[A-Za-z0-9._-]+$", message = "customerId may only contain letters, digits, '.', '_' and '-'")
        @Size(min = 1, max = 100) String customerId,
        @Size(min = 1, max = 255) String name,
        @Size(max = 2000) String description,
        @Valid ThemePayload theme,
        Boolean isActive
) {
}
