package com.scaffold.backend.modules.organization.presentation.dto;

import java.util.Map;

import com.scaffold.backend.modules.organization.domain.OrganizationTheme;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record ThemePayload(
        @Size(max = 100) String id,
        @NotBlank(message = "theme.name is required") @Size(max = 100) String name,
        @NotEmpty(message = "theme.light is required") Map<@NotBlank String, @NotBlank @Size(max = 64) String> light,
        Map<@NotBlank String, @NotBlank @Size(max = 64) String> dark,
        @Size(max = 32) String radius
) {

    public OrganizationTheme toTheme() {
        return new OrganizationTheme(id, name.trim(), light, dark, radius);
    }
}
