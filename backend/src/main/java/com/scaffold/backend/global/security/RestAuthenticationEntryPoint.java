package com.scaffold.backend.global.security;

import java.io.IOException;

import com.scaffold.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String INVALID_ACCESS_TOKEN = "INVALID_ACCESS_TOKEN";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body;
        if (authException instanceof BadCredentialsException && INVALID_ACCESS_TOKEN.equals(authException.getMessage())) {
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, INVALID_ACCESS_TOKEN,
                    "Invalid or expired access token", request.getRequestURI());
        } else {
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED",
                    "Authentication required", request.getRequestURI());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
