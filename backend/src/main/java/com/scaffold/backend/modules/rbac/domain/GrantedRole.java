package com.scaffold.backend.modules.rbac.domain;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of a role and its permissions as carried by a principal or an access token.
 */
public record GrantedRole(UUID id, String name, List<GrantedPermission> permissions) {

    public GrantedRole {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static GrantedRole from(Role role) {
        List<GrantedPermission> permissions = role.getPermissions().stream()
                .sorted(Comparator.comparing(Permission::getResource).thenComparing(Permission::getAction))
                .map(GrantedPermission::from)
                .toList();
        return new GrantedRole(role.getId(), role.getName(), permissions);
    }

    public boolean grants(PermissionName permission) {
        return permissions.stream().anyMatch(granted -> granted.matches(permission));
    }
}
