package com.scaffold.backend.modules.rbac.presentation.dto;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.rbac.domain.Permission;
import com.scaffold.backend.modules.rbac.domain.Role;

public record RoleResponse(UUID id, String name, String description, List<String> permissions) {

    public static RoleResponse from(Role role) {
        List<String> permissions = role.getPermissions().stream()
                .map(Permission::getName)
                .sorted(Comparator.naturalOrder())
                .toList();
        return new RoleResponse(role.getId(), role.getName(), role.getDescription(), permissions);
    }
}
