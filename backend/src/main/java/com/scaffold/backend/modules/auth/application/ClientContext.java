package com.scaffold.backend.modules.auth.application;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

/**
 * Request metadata recorded next to a refresh token.
 */
public record ClientContext(String userAgent, String ipAddress) {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    public static ClientContext none() {
        return new ClientContext(null, null);
    }

    public static ClientContext from(HttpServletRequest request) {
        return new ClientContext(request.getHeader(HttpHeaders.USER_AGENT), clientIp(request));
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            String firstHop = forwarded.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return firstHop;
            }
        }
        return request.getRemoteAddr();
    }
}
