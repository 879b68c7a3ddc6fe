package com.scaffold.backend.global.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;

import com.scaffold.backend.modules.rbac.application.RouteAccessPolicy;

import org.springframework.http.HttpMethod;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

/**
 * Ordered table of {@code (method, path pattern) -> policy}. The first matching entry wins.
 */
public final class RouteAccessRegistry {

    private final List<Entry> entries;

    private RouteAccessRegistry(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RouteAccessPolicy> policyFor(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return policyFor(request.getMethod(), path);
    }

    public Optional<RouteAccessPolicy> policyFor(String method, String path) {
        PathContainer container = PathContainer.parsePath(path);
        return entries.stream()
                .filter(entry -> entry.matches(method, container))
                .map(Entry::policy)
                .findFirst();
    }

    public record Entry(HttpMethod method, PathPattern pattern, RouteAccessPolicy policy) {

        boolean matches(String requestMethod, PathContainer path) {
            if (method != null && !method.matches(requestMethod)) {
                return false;
            }
            return pattern.matches(path);
        }
    }

    public static final class Builder {

        private final PathPatternParser parser = new PathPatternParser();
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder route(HttpMethod method, String pattern, RouteAccessPolicy policy) {
            entries.add(new Entry(method, parser.parse(pattern), policy));
            return this;
        }

        public Builder route(String pattern, RouteAccessPolicy policy) {
            return route(null, pattern, policy);
        }

        public RouteAccessRegistry build() {
            return new RouteAccessRegistry(entries);
        }
    }
}
