package com.scaffold.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import com.scaffold.backend.modules.auth.application.AuthService;
import com.scaffold.backend.modules.auth.application.JwtTokenService;
import com.scaffold.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.scaffold.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer token and replaces its claims with the user's current state: the
 * account must still be active and roles are read from the database, not from the token.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> PUBLIC_AUTH_PATHS = Set.of(
            "/auth/register", "/auth/login", "/auth/refresh", "/auth/logout"
    );

    private final JwtTokenService jwtTokenService;
    private final AuthService authService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            AuthService authService,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.authService = authService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<AuthenticatedPrincipal> principal;
        try {
            ParsedToken parsed = jwtTokenService.parseAccessToken(token);
            principal = authService.loadPrincipal(parsed.userId());
        } catch (InvalidTokenException ex) {
            log.debug("Rejected access token: {}", ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
            principal = Optional.empty();
        }

        if (principal.isEmpty()) {
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response,
                    new BadCredentialsException(RestAuthenticationEntryPoint.INVALID_ACCESS_TOKEN));
            return;
        }

        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                principal.get(), token, authorities(principal.get()));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return PUBLIC_AUTH_PATHS.contains(path)
                || path.startsWith("/health")
                || path.startsWith("/oauth2/")
                || path.startsWith("/login/oauth2/")
                || path.startsWith("/v1/themes/");
    }

    private static List<SimpleGrantedAuthority> authorities(AuthenticatedPrincipal principal) {
        return Stream.concat(
                        principal.roleNames().stream().map(role -> "ROLE_" + role),
                        principal.permissionNames().stream())
                .map(SimpleGrantedAuthority::new)
                .toList();
    }
}
