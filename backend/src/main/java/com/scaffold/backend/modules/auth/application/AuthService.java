package com.scaffold.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.global.security.AuthenticatedPrincipal;
import com.scaffold.backend.modules.auth.application.oauth.OAuthAccountResolver;
import com.scaffold.backend.modules.auth.application.oauth.OAuthProfile;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.auth.presentation.dto.AuthResponse;
import com.scaffold.backend.modules.auth.presentation.dto.CurrentUserResponse;
import com.scaffold.backend.modules.auth.presentation.dto.LoginRequest;
import com.scaffold.backend.modules.auth.presentation.dto.PublicUserResponse;
import com.scaffold.backend.modules.auth.presentation.dto.RegisterRequest;
import com.scaffold.backend.modules.rbac.application.RbacService;
import com.scaffold.backend.modules.rbac.domain.GrantedRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final int BCRYPT_MAX_INPUT_BYTES = 72;

    private final UserAccountRepository userAccountRepository;
    private final RbacService rbacService;
    private final RefreshTokenService refreshTokenService;
    private final JwtTokenService jwtTokenService;
    private final OAuthAccountResolver oauthAccountResolver;
    private final PasswordEncoder passwordEncoder;
    private final AuthProperties properties;
    private final String unknownUserHash;

    public AuthService(
            UserAccountRepository userAccountRepository,
            RbacService rbacService,
            RefreshTokenService refreshTokenService,
            JwtTokenService jwtTokenService,
            OAuthAccountResolver oauthAccountResolver,
            PasswordEncoder passwordEncoder,
            AuthProperties properties
    ) {
        this.userAccountRepository = userAccountRepository;
        this.rbacService = rbacService;
        this.refreshTokenService = refreshTokenService;
        this.jwtTokenService = jwtTokenService;
        this.oauthAccountResolver = oauthAccountResolver;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.unknownUserHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public AuthResponse register(RegisterRequest request, ClientContext client) {
        if (exceedsBcryptInput(request.password())) {
            throw new ProblemException(
                    HttpStatus.UNPROCESSABLE_ENTITY,
                    "validation_error",
                    "password: must be at most " + BCRYPT_MAX_INPUT_BYTES + " bytes in UTF-8"
            );
        }
        String email = UserAccount.normalizeEmail(request.email());
        if (userAccountRepository.existsByEmail(email)) {
            throw emailAlreadyRegistered();
        }

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setName(request.name());
        user.usePasswordProvider();
        rbacService.findRoleByName(properties.defaultRole()).ifPresentOrElse(
                user.getRoles()::add,
                () -> log.warn("Default role {} does not exist; user registered without roles", properties.defaultRole())
        );

        try {
            user = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw emailAlreadyRegistered();
        }
        log.info("Registered user {}", user.getId());
        return issueTokens(user, client);
    }

    @Transactional(noRollbackFor = ProblemException.class)
    public AuthResponse login(LoginRequest request, ClientContext client) {
        String email = UserAccount.normalizeEmail(request.email());
        Optional<UserAccount> candidate = userAccountRepository.findWithRolesByEmail(email);
        if (candidate.isEmpty()) {
            // equalize response time with the wrong-password path
            passwordMatches(request.password(), unknownUserHash);
            throw invalidCredentials();
        }

        UserAccount user = candidate.get();
        if (!user.hasPassword()) {
            throw ProblemException.unauthorized(
                    "OAUTH_ACCOUNT",
                    "This account uses " + providerLabel(user) + " sign-in. Please log in with your OAuth provider."
            );
        }
        if (!passwordMatches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }
        if (!user.isActive()) {
            throw accountInactive();
        }
        return issueTokens(user, client);
    }

    /**
     * Mints a new access token. The refresh token is returned unchanged.
     */
    public AuthResponse refresh(String refreshToken) {
        UserAccount user = refreshTokenService.validateRefreshToken(refreshToken);
        JwtTokenService.IssuedAccessToken accessToken = jwtTokenService.issueAccessToken(user);
        return AuthResponse.bearer(
                accessToken.token(),
                accessToken.expiresInSeconds(),
                refreshToken,
                PublicUserResponse.from(user)
        );
    }

    public void logout(String refreshToken) {
        refreshTokenService.revokeRefreshToken(refreshToken);
    }

    public int logoutEverywhere(UUID userId) {
        return refreshTokenService.revokeAllUserTokens(userId);
    }

    /**
     * Resolves an OAuth identity to a local account, creating or linking one when needed.
     * A duplicate-key failure from a concurrent first login is retried once as a lookup.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public UserAccount findOrCreateOAuthUser(OAuthProfile profile) {
        try {
            return oauthAccountResolver.resolve(profile);
        } catch (DataIntegrityViolationException race) {
            log.info("Concurrent {} login for provider id {}; retrying as lookup", profile.provider(), profile.providerId());
            try {
                return oauthAccountResolver.resolve(profile);
            } catch (DataIntegrityViolationException ex) {
                throw ProblemException.conflict("RESOURCE_CONFLICT", "Account is being created concurrently; retry the login");
            }
        }
    }

    /**
     * Starts a session for an already authenticated account, as after an OAuth callback.
     */
    public AuthResponse issueSession(UUID userId, ClientContext client) {
        UserAccount user = userAccountRepository.findWithRolesById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + userId + " not found"));
        if (!user.isActive()) {
            throw accountInactive();
        }
        return issueTokens(user, client);
    }

    /**
     * Returns the account only while it exists and is active.
     */
    @Transactional(readOnly = true)
    public Optional<UserAccount> validateUser(UUID userId) {
        return userAccountRepository.findActiveWithRolesById(userId);
    }

    /**
     * Loads the request principal from the database so role changes and deactivation apply
     * to tokens that were issued earlier.
     */
    @Transactional(readOnly = true)
    public Optional<AuthenticatedPrincipal> loadPrincipal(UUID userId) {
        return validateUser(userId)
                .map(user -> new AuthenticatedPrincipal(user.getId(), user.getEmail(), grantedRoles(user)));
    }

    @Transactional(readOnly = true)
    public CurrentUserResponse currentUser(UUID userId) {
        UserAccount user = validateUser(userId)
                .orElseThrow(() -> ProblemException.unauthorized("INVALID_ACCESS_TOKEN", "User no longer active"));
        List<GrantedRole> roles = grantedRoles(user);
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(user.getId(), user.getEmail(), roles);
        return new CurrentUserResponse(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getAuthProvider(),
                user.isActive(),
                user.getCreatedAt(),
                principal.roleNames(),
                principal.permissionNames()
        );
    }

    private AuthResponse issueTokens(UserAccount user, ClientContext client) {
        ClientContext context = client != null ? client : ClientContext.none();
        JwtTokenService.IssuedAccessToken accessToken = jwtTokenService.issueAccessToken(user);
        String refreshToken = refreshTokenService.createRefreshToken(user, context.userAgent(), context.ipAddress());
        return AuthResponse.bearer(
                accessToken.token(),
                accessToken.expiresInSeconds(),
                refreshToken,
                PublicUserResponse.from(user)
        );
    }

    private boolean passwordMatches(String rawPassword, String hash) {
        if (rawPassword == null || exceedsBcryptInput(rawPassword)) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, hash);
    }

    private static boolean exceedsBcryptInput(String rawPassword) {
        return rawPassword != null && rawPassword.getBytes(StandardCharsets.UTF_8).length > BCRYPT_MAX_INPUT_BYTES;
    }

    private static List<GrantedRole> grantedRoles(UserAccount user) {
        return user.getRoles().stream()
                .map(GrantedRole::from)
                .sorted(Comparator.comparing(GrantedRole::name))
                .toList();
    }

    private static String providerLabel(UserAccount user) {
        String provider = user.getAuthProvider();
        return provider == null || provider.isBlank() ? "OAuth" : provider;
    }

    private static ProblemException emailAlreadyRegistered() {
        return ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "Email already registered");
    }

    private static ProblemException invalidCredentials() {
        return ProblemException.unauthorized("INVALID_CREDENTIALS", "Invalid credentials");
    }

    private static ProblemException accountInactive() {
        return ProblemException.unauthorized("ACCOUNT_INACTIVE", "Account is not active");
    }
}
