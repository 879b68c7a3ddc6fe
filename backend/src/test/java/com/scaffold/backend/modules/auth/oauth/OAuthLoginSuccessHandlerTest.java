package com.scaffold.backend.modules.auth.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.application.AuthService;
import com.scaffold.backend.modules.auth.application.oauth.GoogleProfileMapper;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProfile;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProvider;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProviderRegistry;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.presentation.OAuthLoginSuccessHandler;
import com.scaffold.backend.modules.auth.presentation.dto.AuthResponse;
import com.scaffold.backend.modules.auth.presentation.dto.PublicUserResponse;
import com.scaffold.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.user.DefaultOAuth2User;

@ExtendWith(MockitoExtension.class)
class OAuthLoginSuccessHandlerTest {

    @Mock
    private OAuthProviderRegistry providerRegistry;

    @Mock
    private AuthService authService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OAuthLoginSuccessHandler handler;

    @BeforeEach
    void setUp() {
        handler = new OAuthLoginSuccessHandler(providerRegistry, authService, objectMapper);
    }

    @Test
    void writesTokenPayloadForResolvedAccount() throws Exception {
        UUID userId = UUID.randomUUID();
        UserAccount user = TestEntities.withId(new UserAccount(), userId);
        when(providerRegistry.find("google")).thenReturn(Optional.of(googleProvider()));
        when(authService.findOrCreateOAuthUser(any(OAuthProfile.class))).thenReturn(user);
        when(authService.issueSession(eq(userId), any())).thenReturn(AuthResponse.bearer(
                "access", 900, "refresh", new PublicUserResponse(userId, "g@x.com", "Gee", "google")));

        MockHttpServletResponse response = new MockHttpServletResponse();
        handler.onAuthenticationSuccess(callback(), response, googleLogin(Map.of("sub", "1234", "email", "g@x.com")));

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(body.path("accessToken").asText()).isEqualTo("access");
        assertThat(body.path("refreshToken").asText()).isEqualTo("refresh");
        assertThat(body.path("user").has("passwordHash")).isFalse();
    }

    @Test
    void incompleteProfileIsRejectedWithoutTouchingAccounts() throws Exception {
        when(providerRegistry.find("google")).thenReturn(Optional.of(googleProvider()));

        MockHttpServletResponse response = new MockHttpServletResponse();
        handler.onAuthenticationSuccess(callback(), response, googleLogin(Map.of("sub", "1234")));

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(objectMapper.readTree(response.getContentAsString()).path("code").asText()).isEqualTo("OAUTH_FAILED");
        verify(authService, never()).findOrCreateOAuthUser(any());
    }

    @Test
    void conflictFromResolutionIsRendered() throws Exception {
        when(providerRegistry.find("google")).thenReturn(Optional.of(googleProvider()));
        when(authService.findOrCreateOAuthUser(any(OAuthProfile.class)))
                .thenThrow(ProblemException.conflict("RESOURCE_CONFLICT", "retry"));

        MockHttpServletResponse response = new MockHttpServletResponse();
        handler.onAuthenticationSuccess(callback(), response, googleLogin(Map.of("sub", "1234", "email", "g@x.com")));

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(objectMapper.readTree(response.getContentAsString()).path("code").asText()).isEqualTo("RESOURCE_CONFLICT");
    }

    private static OAuthProvider googleProvider() {
        return new OAuthProvider(GoogleProfileMapper.PROVIDER, null, new GoogleProfileMapper());
    }

    private static MockHttpServletRequest callback() {
        return new MockHttpServletRequest("GET", "/login/oauth2/code/google");
    }

    private static OAuth2AuthenticationToken googleLogin(Map<String, Object> attributes) {
        DefaultOAuth2User principal = new DefaultOAuth2User(
                AuthorityUtils.createAuthorityList("OAUTH2_USER"), attributes, "sub");
        return new OAuth2AuthenticationToken(principal, List.of(), "google");
    }
}
