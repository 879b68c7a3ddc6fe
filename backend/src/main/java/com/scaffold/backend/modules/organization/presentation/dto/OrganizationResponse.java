package com.scaffold.backend.modules.organization.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.organization.domain.Organization;
import com.scaffold.backend.modules.organization.domain.OrganizationTheme;

public record OrganizationResponse(
        UUID id,
        String customerId,
        String name,
        String description,
        OrganizationTheme theme,
        boolean isActive,
        List<UUID> memberIds,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static OrganizationResponse from(Organization organization) {
        return new OrganizationResponse(
                organization.getId(),
                organization.getCustomerId(),
                organization.getName(),
                organization.getDescription(),
                organization.getTheme(),
                organization.isActive(),
                organization.getMembers().stream().map(UserAccount::getId).sorted().toList(),
                organization.getCreatedAt(),
                organization.getUpdatedAt()
        );
    }
}
