package com.scaffold.backend.modules.rbac.application;

import java.util.Arrays;
import java.util.Set;

import com.scaffold.backend.global.security.AuthenticatedPrincipal;

/**
 * Requirements attached to a route. Roles are alternatives, permissions are all required,
 * and both checks must pass. An empty set places no restriction.
 */
public record RouteAccessPolicy(Set<String> requiredRoles, Set<String> requiredPermissions) {

    private static final RouteAccessPolicy AUTHENTICATED = new RouteAccessPolicy(Set.of(), Set.of());

    public RouteAccessPolicy {
        requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
        requiredPermissions = requiredPermissions == null ? Set.of() : Set.copyOf(requiredPermissions);
    }

    public static RouteAccessPolicy authenticated() {
        return AUTHENTICATED;
    }

    public static RouteAccessPolicy roles(String... roles) {
        return new RouteAccessPolicy(Set.of(roles), Set.of());
    }

    public static RouteAccessPolicy permissions(String... permissions) {
        return new RouteAccessPolicy(Set.of(), Set.of(permissions));
    }

    public RouteAccessPolicy andRoles(String... roles) {
        return new RouteAccessPolicy(Set.copyOf(Arrays.asList(roles)), requiredPermissions);
    }

    public boolean isUnrestricted() {
        return requiredRoles.isEmpty() && requiredPermissions.isEmpty();
    }

    public boolean isSatisfiedBy(AuthenticatedPrincipal principal) {
        if (principal == null) {
            return false;
        }
        boolean rolesOk = requiredRoles.isEmpty() || AccessDecisions.hasAnyRole(principal, requiredRoles);
        boolean permissionsOk = requiredPermissions.isEmpty()
                || AccessDecisions.hasAllPermissions(principal, requiredPermissions);
        return rolesOk && permissionsOk;
    }
}
