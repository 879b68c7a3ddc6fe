package com.scaffold.backend.modules.rbac.application;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

import com.scaffold.backend.global.security.AuthenticatedPrincipal;
import com.scaffold.backend.modules.rbac.domain.PermissionName;

/**
 * Role and permission predicates over a principal. Never throws; an absent principal or a
 * malformed permission string evaluates to {@code false}.
 */
public final class AccessDecisions {

    private AccessDecisions() {
    }

    public static boolean hasRole(AuthenticatedPrincipal principal, String roleName) {
        if (principal == null || roleName == null) {
            return false;
        }
        return principal.roles().stream().anyMatch(role -> roleName.equals(role.name()));
    }

    public static boolean hasPermission(AuthenticatedPrincipal principal, String permissionName) {
        if (principal == null) {
            return false;
        }
        Optional<PermissionName> parsed = PermissionName.parse(permissionName);
        if (parsed.isEmpty()) {
            return false;
        }
        PermissionName permission = parsed.get();
        return principal.roles().stream().anyMatch(role -> role.grants(permission));
    }

    public static boolean hasAnyRole(AuthenticatedPrincipal principal, Collection<String> roleNames) {
        if (roleNames == null) {
            return false;
        }
        return roleNames.stream()
                .filter(Objects::nonNull)
                .anyMatch(roleName -> hasRole(principal, roleName));
    }

    public static boolean hasAllPermissions(AuthenticatedPrincipal principal, Collection<String> permissionNames) {
        if (permissionNames == null) {
            return false;
        }
        return permissionNames.stream().allMatch(permissionName -> hasPermission(principal, permissionName));
    }

    public static boolean hasAnyPermission(AuthenticatedPrincipal principal, Collection<String> permissionNames) {
        if (permissionNames == null) {
            return false;
        }
        return permissionNames.stream().anyMatch(permissionName -> hasPermission(principal, permissionName));
    }
}
