package com.scaffold.backend.modules.auth.presentation;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.global.error.ProblemResponse;
import com.scaffold.backend.modules.auth.application.AuthService;
import com.scaffold.backend.modules.auth.application.ClientContext;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProfile;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProvider;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProviderRegistry;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.presentation.dto.AuthResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

/**
 * Completes an OAuth callback: resolves the local account, then answers with the same
 * token payload as a password login.
 */
@Component
public class OAuthLoginSuccessHandler implements AuthenticationSuccessHandler {

    private static final Logger log = LoggerFactory.getLogger(OAuthLoginSuccessHandler.class);

    private final OAuthProviderRegistry providerRegistry;
    private final AuthService authService;
    private final ObjectMapper objectMapper;

    public OAuthLoginSuccessHandler(OAuthProviderRegistry providerRegistry, AuthService authService, ObjectMapper objectMapper) {
        this.providerRegistry = providerRegistry;
        this.authService = authService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response, Authentication authentication)
            throws IOException {
        if (!(authentication instanceof OAuth2AuthenticationToken token)) {
            writeProblem(request, response, HttpStatus.UNAUTHORIZED, "OAUTH_FAILED", "Unsupported authentication");
            return;
        }
        String providerName = token.getAuthorizedClientRegistrationId();
        OAuthProvider provider = providerRegistry.find(providerName).orElse(null);
        if (provider == null) {
            writeProblem(request, response, HttpStatus.UNAUTHORIZED, "OAUTH_FAILED", "Unknown OAuth provider");
            return;
        }

        AuthResponse body;
        try {
            OAuthProfile profile = provider.profileMapper().map(token.getPrincipal().getAttributes());
            UserAccount user = authService.findOrCreateOAuthUser(profile);
            body = authService.issueSession(user.getId(), ClientContext.from(request));
        } catch (OAuth2AuthenticationException ex) {
            log.warn("OAuth profile from {} rejected: {}", providerName, ex.getError().getDescription());
            writeProblem(request, response, HttpStatus.UNAUTHORIZED, "OAUTH_FAILED", ex.getError().getDescription());
            return;
        } catch (ProblemException ex) {
            HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
            writeProblem(request, response, status, ex.getCode(), ex.getDetailMessage());
            return;
        }

        log.info("OAuth login via {} for user {}", providerName, body.user().id());
        response.setStatus(HttpStatus.OK.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }

    private void writeProblem(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String code, String detail)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ProblemResponse.of(status, code, detail, request.getRequestURI()));
    }
}
