package com.scaffold.backend.modules.rbac;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import com.scaffold.backend.global.security.AuthenticatedPrincipal;
import com.scaffold.backend.modules.rbac.application.RouteAccessPolicy;
import com.scaffold.backend.modules.rbac.domain.GrantedPermission;
import com.scaffold.backend.modules.rbac.domain.GrantedRole;

import org.junit.jupiter.api.Test;

class RouteAccessPolicyTest {

    private final AuthenticatedPrincipal moderator = new AuthenticatedPrincipal(
            UUID.randomUUID(),
            "mod@x.com",
            List.of(new GrantedRole(UUID.randomUUID(), "moderator", List.of(
                    new GrantedPermission("products", "read"),
                    new GrantedPermission("products", "update")
            )))
    );

    @Test
    void authenticatedPolicyAcceptsAnyPrincipal() {
        assertThat(RouteAccessPolicy.authenticated().isUnrestricted()).isTrue();
        assertThat(RouteAccessPolicy.authenticated().isSatisfiedBy(moderator)).isTrue();
        assertThat(RouteAccessPolicy.authenticated().isSatisfiedBy(null)).isFalse();
    }

    @Test
    void rolesAndPermissionsMustBothPass() {
        RouteAccessPolicy update = RouteAccessPolicy.permissions("products:update").andRoles("admin", "moderator");
        RouteAccessPolicy delete = RouteAccessPolicy.permissions("products:delete").andRoles("admin");
        RouteAccessPolicy wrongRole = RouteAccessPolicy.permissions("products:read").andRoles("admin");

        assertThat(update.isSatisfiedBy(moderator)).isTrue();
        assertThat(delete.isSatisfiedBy(moderator)).isFalse();
        assertThat(wrongRole.isSatisfiedBy(moderator)).isFalse();
    }

    @Test
    void permissionListIsConjunctive() {
        assertThat(RouteAccessPolicy.permissions("products:read", "products:update").isSatisfiedBy(moderator)).isTrue();
        assertThat(RouteAccessPolicy.permissions("products:read", "products:create").isSatisfiedBy(moderator)).isFalse();
    }
}
