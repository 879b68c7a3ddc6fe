package com.scaffold.backend.modules.organization.domain;

import java.util.Map;

/**
 * White-label theme stored as JSON on the organization. Colour maps are keyed by design
 * token ({@code background}, {@code primary}, {@code primaryForeground}, ...).
 *
 * @param id     client-side theme identifier
 * @param name   display name
 * @param light  light-mode colours, required
 * @param dark   dark-mode colours, optional
 * @param radius corner radius as a CSS length, optional
 */
public record OrganizationTheme(
        String id,
        String name,
        Map<String, String> light,
        Map<String, String> dark,
        String radius
) {

    public OrganizationTheme {
        light = light == null ? Map.of() : Map.copyOf(light);
        dark = dark == null ? null : Map.copyOf(dark);
    }
}
