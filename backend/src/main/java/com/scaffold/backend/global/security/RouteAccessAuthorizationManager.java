package com.scaffold.backend.global.security;

import java.util.function.Supplier;

import com.scaffold.backend.modules.rbac.application.RouteAccessPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * Evaluates the route policy registered for the request against the principal loaded by
 * {@link JwtAuthenticationFilter}. Routes without an entry only require authentication.
 */
public class RouteAccessAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private static final Logger log = LoggerFactory.getLogger(RouteAccessAuthorizationManager.class);

    private final RouteAccessRegistry registry;

    public RouteAccessAuthorizationManager(RouteAccessRegistry registry) {
        this.registry = registry;
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        Authentication current = authentication.get();
        if (current == null || !(current.getPrincipal() instanceof AuthenticatedPrincipal principal)) {
            return new AuthorizationDecision(false);
        }
        RouteAccessPolicy policy = registry.policyFor(context.getRequest())
                .orElse(RouteAccessPolicy.authenticated());
        boolean granted = policy.isSatisfiedBy(principal);
        if (!granted) {
            log.debug("Denied {} {} for user {} (roles={}, required={})",
                    context.getRequest().getMethod(), context.getRequest().getRequestURI(),
                    principal.userId(), principal.roleNames(), policy);
        }
        return new AuthorizationDecision(granted);
    }
}
