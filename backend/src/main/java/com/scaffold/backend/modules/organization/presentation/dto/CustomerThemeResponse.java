package com.scaffold.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;

import com.scaffold.backend.modules.organization.domain.Organization;
import com.scaffold.backend.modules.organization.domain.OrganizationTheme;

public record CustomerThemeResponse(
        String customerId,
        String customerName,
        OrganizationTheme theme,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CustomerThemeResponse from(Organization organization) {
        return new CustomerThemeResponse(
                organization.getCustomerId(),
                organization.getName(),
                organization.getTheme(),
                organization.getCreatedAt(),
                organization.getUpdatedAt()
        );
    }
}
