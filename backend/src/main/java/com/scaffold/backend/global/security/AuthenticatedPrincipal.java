package com.scaffold.backend.global.security;

import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.rbac.domain.GrantedPermission;
import com.scaffold.backend.modules.rbac.domain.GrantedRole;

/**
 * Identity attached to an authenticated request, with roles as loaded from the database
 * for that request.
 */
public record AuthenticatedPrincipal(UUID userId, String email, List<GrantedRole> roles) {

    public AuthenticatedPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public List<String> roleNames() {
        return roles.stream().map(GrantedRole::name).toList();
    }

    public List<String> permissionNames() {
        return roles.stream()
                .flatMap(role -> role.permissions().stream())
                .map(GrantedPermission::name)
                .distinct()
                .toList();
    }
}
