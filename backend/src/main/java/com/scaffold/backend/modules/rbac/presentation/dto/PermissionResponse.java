package com.scaffold.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import com.scaffold.backend.modules.rbac.domain.Permission;

public record PermissionResponse(UUID id, String resource, String action, String name, String description) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getResource(),
                permission.getAction(),
                permission.getName(),
                permission.getDescription()
        );
    }
}
