package com.scaffold.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.application.AuthProperties;
import com.scaffold.backend.modules.auth.application.AuthService;
import com.scaffold.backend.modules.auth.application.ClientContext;
import com.scaffold.backend.modules.auth.application.JwtTokenService;
import com.scaffold.backend.modules.auth.application.RefreshTokenService;
import com.scaffold.backend.modules.auth.application.oauth.OAuthAccountResolver;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProfile;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.auth.presentation.dto.AuthResponse;
import com.scaffold.backend.modules.auth.presentation.dto.LoginRequest;
import com.scaffold.backend.modules.auth.presentation.dto.RegisterRequest;
import com.scaffold.backend.modules.rbac.application.RbacService;
import com.scaffold.backend.modules.rbac.domain.Permission;
import com.scaffold.backend.modules.rbac.domain.Role;
import com.scaffold.backend.support.TestAuthProperties;
import com.scaffold.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final ClientContext CLIENT = new ClientContext("JUnit", "127.0.0.1");

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private RbacService rbacService;

    @Mock
    private RefreshTokenService refreshTokenService;

    @Mock
    private OAuthAccountResolver oauthAccountResolver;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private JwtTokenService jwtTokenService;
    private AuthService authService;
    private Role userRole;

    @BeforeEach
    void setUp() {
        AuthProperties properties = TestAuthProperties.defaults();
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider(properties),
                properties,
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC)
        );
        authService = new AuthService(
                userAccountRepository,
                rbacService,
                refreshTokenService,
                jwtTokenService,
                oauthAccountResolver,
                passwordEncoder,
                properties
        );

        userRole = TestEntities.withId(new Role("user", null), UUID.randomUUID());
        userRole.replacePermissions(List.of(new Permission("products", "read", null)));
        lenient().when(rbacService.findRoleByName("user")).thenReturn(Optional.of(userRole));
        lenient().when(refreshTokenService.createRefreshToken(any(), any(), any()))
                .thenAnswer(invocation -> "refresh-" + UUID.randomUUID());
        lenient().when(userAccountRepository.saveAndFlush(any(UserAccount.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), UUID.randomUUID()));
    }

    @Test
    @DisplayName("register then login with the same password succeeds, a wrong password fails")
    void registerThenLogin() {
        when(userAccountRepository.existsByEmail("a@x.com")).thenReturn(false);

        AuthResponse registered = authService.register(new RegisterRequest("a@x.com", "Secret123!", "Alice"), CLIENT);

        ArgumentCaptor<UserAccount> saved = ArgumentCaptor.forClass(UserAccount.class);
        verify(userAccountRepository).saveAndFlush(saved.capture());
        UserAccount account = saved.getValue();
        assertThat(account.getPasswordHash()).isNotEqualTo("Secret123!");
        assertThat(account.getAuthProvider()).isEqualTo(UserAccount.PASSWORD_PROVIDER);
        assertThat(account.getRoles()).containsExactly(userRole);
        assertThat(registered.accessToken()).isNotBlank();
        assertThat(registered.refreshToken()).isNotBlank();
        assertThat(registered.tokenType()).isEqualTo("Bearer");
        assertThat(registered.user().email()).isEqualTo("a@x.com");
        verify(refreshTokenService).createRefreshToken(account, "JUnit", "127.0.0.1");

        when(userAccountRepository.findWithRolesByEmail("a@x.com")).thenReturn(Optional.of(account));

        AuthResponse loggedIn = authService.login(new LoginRequest("a@x.com", "Secret123!"), CLIENT);
        assertThat(loggedIn.accessToken()).isNotBlank();
        assertThat(loggedIn.refreshToken()).isNotBlank();
        assertThat(jwtTokenService.parseAccessToken(loggedIn.accessToken()).userId()).isEqualTo(account.getId());

        assertProblem(() -> authService.login(new LoginRequest("a@x.com", "wrong"), CLIENT),
                401, "INVALID_CREDENTIALS");
    }

    @Test
    void registerNormalizesEmail() {
        when(userAccountRepository.existsByEmail("mixed@x.com")).thenReturn(false);

        AuthResponse response = authService.register(new RegisterRequest("  Mixed@X.com ", "Secret123!", null), CLIENT);

        assertThat(response.user().email()).isEqualTo("mixed@x.com");
    }

    @Test
    void duplicateRegistrationConflicts() {
        when(userAccountRepository.existsByEmail("dup@x.com")).thenReturn(false, true);

        authService.register(new RegisterRequest("dup@x.com", "Secret123!", null), CLIENT);

        assertProblem(() -> authService.register(new RegisterRequest("dup@x.com", "Secret123!", null), CLIENT),
                409, "EMAIL_ALREADY_REGISTERED");
    }

    @Test
    void concurrentDuplicateRegistrationConflicts() {
        when(userAccountRepository.existsByEmail("dup@x.com")).thenReturn(false);
        when(userAccountRepository.saveAndFlush(any(UserAccount.class)))
                .thenThrow(new DataIntegrityViolationException("uq_users_email"));

        assertProblem(() -> authService.register(new RegisterRequest("dup@x.com", "Secret123!", null), CLIENT),
                409, "EMAIL_ALREADY_REGISTERED");
        verify(refreshTokenService, never()).createRefreshToken(any(), any(), any());
    }

    @Test
    @DisplayName("a multibyte password that bcrypt would truncate is refused at registration")
    void multibytePasswordOverBcryptLimitIsRejectedAtRegistration() {
        String password = "密".repeat(30);

        assertProblem(() -> authService.register(new RegisterRequest("han@x.com", password, null), CLIENT),
                422, "validation_error");
        verify(userAccountRepository, never()).saveAndFlush(any(UserAccount.class));
        verify(refreshTokenService, never()).createRefreshToken(any(), any(), any());
    }

    @Test
    void multibytePasswordWithinBcryptLimitRegistersAndLogsIn() {
        String password = "密".repeat(24);
        when(userAccountRepository.existsByEmail("han@x.com")).thenReturn(false);

        authService.register(new RegisterRequest("han@x.com", password, null), CLIENT);

        ArgumentCaptor<UserAccount> saved = ArgumentCaptor.forClass(UserAccount.class);
        verify(userAccountRepository).saveAndFlush(saved.capture());
        when(userAccountRepository.findWithRolesByEmail("han@x.com")).thenReturn(Optional.of(saved.getValue()));

        assertThat(authService.login(new LoginRequest("han@x.com", password), CLIENT).accessToken()).isNotBlank();
    }

    @Test
    void oauthOnlyAccountGetsDistinctLoginError() {
        UserAccount oauthUser = TestEntities.withId(new UserAccount(), UUID.randomUUID());
        oauthUser.setEmail("g@x.com");
        oauthUser.linkProvider("google", "g-1", null);
        when(userAccountRepository.findWithRolesByEmail("g@x.com")).thenReturn(Optional.of(oauthUser));

        ProblemException problem = assertProblem(
                () -> authService.login(new LoginRequest("g@x.com", "anything"), CLIENT), 401, "OAUTH_ACCOUNT");
        assertThat(problem.getDetailMessage()).contains("google");
    }

    @Test
    void unknownEmailIsInvalidCredentials() {
        when(userAccountRepository.findWithRolesByEmail("ghost@x.com")).thenReturn(Optional.empty());

        assertProblem(() -> authService.login(new LoginRequest("ghost@x.com", "Secret123!"), CLIENT),
                401, "INVALID_CREDENTIALS");
    }

    @Test
    void inactiveAccountIsRejectedAfterPasswordCheck() {
        UserAccount inactive = passwordUser("off@x.com", "Secret123!");
        inactive.setActive(false);
        when(userAccountRepository.findWithRolesByEmail("off@x.com")).thenReturn(Optional.of(inactive));

        assertProblem(() -> authService.login(new LoginRequest("off@x.com", "Secret123!"), CLIENT),
                401, "ACCOUNT_INACTIVE");
        assertProblem(() -> authService.login(new LoginRequest("off@x.com", "wrong"), CLIENT),
                401, "INVALID_CREDENTIALS");
    }

    @Test
    void oversizedPasswordIsRejectedAsInvalidCredentials() {
        UserAccount user = passwordUser("long@x.com", "Secret123!");
        when(userAccountRepository.findWithRolesByEmail("long@x.com")).thenReturn(Optional.of(user));

        assertProblem(() -> authService.login(new LoginRequest("long@x.com", "x".repeat(100)), CLIENT),
                401, "INVALID_CREDENTIALS");
    }

    @Test
    void refreshReturnsSameRefreshToken() {
        UserAccount user = passwordUser("r@x.com", "Secret123!");
        when(refreshTokenService.validateRefreshToken("raw-refresh")).thenReturn(user);

        AuthResponse response = authService.refresh("raw-refresh");

        assertThat(response.refreshToken()).isEqualTo("raw-refresh");
        assertThat(jwtTokenService.parseAccessToken(response.accessToken()).userId()).isEqualTo(user.getId());
        verify(refreshTokenService, never()).createRefreshToken(any(), any(), any());
    }

    @Test
    void oauthRaceIsRetriedAsLookup() {
        OAuthProfile profile = new OAuthProfile("github", "42", "octo@x.com", "Octo", Map.of());
        UserAccount existing = TestEntities.withId(new UserAccount(), UUID.randomUUID());
        when(oauthAccountResolver.resolve(profile))
                .thenThrow(new DataIntegrityViolationException("uq_users_auth_provider_identity"))
                .thenReturn(existing);

        assertThat(authService.findOrCreateOAuthUser(profile)).isSameAs(existing);
        verify(oauthAccountResolver, times(2)).resolve(profile);
    }

    @Test
    void oauthRaceThatPersistsSurfacesAsConflict() {
        OAuthProfile profile = new OAuthProfile("github", "42", "octo@x.com", "Octo", Map.of());
        when(oauthAccountResolver.resolve(profile))
                .thenThrow(new DataIntegrityViolationException("first"))
                .thenThrow(new DataIntegrityViolationException("second"));

        assertProblem(() -> authService.findOrCreateOAuthUser(profile), 409, "RESOURCE_CONFLICT");
    }

    @Test
    void issueSessionRejectsInactiveAccount() {
        UserAccount inactive = passwordUser("s@x.com", "Secret123!");
        inactive.setActive(false);
        when(userAccountRepository.findWithRolesById(inactive.getId())).thenReturn(Optional.of(inactive));

        assertProblem(() -> authService.issueSession(inactive.getId(), CLIENT), 401, "ACCOUNT_INACTIVE");
    }

    @Test
    void loadPrincipalReflectsCurrentRoles() {
        UserAccount user = passwordUser("p@x.com", "Secret123!");
        user.getRoles().add(userRole);
        when(userAccountRepository.findActiveWithRolesById(user.getId())).thenReturn(Optional.of(user));

        assertThat(authService.loadPrincipal(user.getId())).hasValueSatisfying(principal -> {
            assertThat(principal.roleNames()).containsExactly("user");
            assertThat(principal.permissionNames()).containsExactly("products:read");
        });
    }

    @Test
    void logoutDelegatesRevocation() {
        authService.logout("raw");

        verify(refreshTokenService).revokeRefreshToken(eq("raw"));
        verify(refreshTokenService, never()).revokeAllUserTokens(any());
        verify(userAccountRepository, never()).findWithRolesByEmail(anyString());
    }

    private UserAccount passwordUser(String email, String rawPassword) {
        UserAccount user = TestEntities.withId(new UserAccount(), UUID.randomUUID());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.usePasswordProvider();
        return user;
    }

    private static ProblemException assertProblem(Runnable action, int status, String code) {
        ProblemException[] captured = new ProblemException[1];
        assertThatThrownBy(action::run)
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode().value()).isEqualTo(status);
                    assertThat(ex.getCode()).isEqualTo(code);
                    captured[0] = ex;
                });
        return captured[0];
    }
}
