package com.scaffold.backend.modules.rbac.domain;

import java.util.Optional;

/**
 * Parsed form of a {@code resource:action} permission string.
 */
public record PermissionName(String resource, String action) {

    private static final char SEPARATOR = ':';

    /**
     * Splits at the first colon. Returns empty when there is no colon or either side is blank.
     */
    public static Optional<PermissionName> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int separator = value.indexOf(SEPARATOR);
        if (separator <= 0 || separator == value.length() - 1) {
            return Optional.empty();
        }
        String resource = value.substring(0, separator);
        String action = value.substring(separator + 1);
        if (resource.isBlank() || action.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new PermissionName(resource, action));
    }

    @Override
    public String toString() {
        return resource + SEPARATOR + action;
    }
}
