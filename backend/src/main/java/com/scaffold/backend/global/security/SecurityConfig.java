package com.scaffold.backend.global.security;

import java.util.Arrays;

import com.scaffold.backend.modules.auth.application.oauth.OAuthProviderRegistry;
import com.scaffold.backend.modules.auth.presentation.OAuthLoginFailureHandler;
import com.scaffold.backend.modules.auth.presentation.OAuthLoginSuccessHandler;
import com.scaffold.backend.modules.rbac.application.RouteAccessPolicy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.client.registration.InMemoryClientRegistrationRepository;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Value("${app.cors.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String allowedOrigins;

    private final JwtAuthenticationFilter jwtAuthenticationFilter;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final RestAccessDeniedHandler accessDeniedHandler;
    private final OAuthProviderRegistry oauthProviders;
    private final OAuthLoginSuccessHandler oauthSuccessHandler;
    private final OAuthLoginFailureHandler oauthFailureHandler;

    public SecurityConfig(
            JwtAuthenticationFilter jwtAuthenticationFilter,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            RestAccessDeniedHandler accessDeniedHandler,
            OAuthProviderRegistry oauthProviders,
            OAuthLoginSuccessHandler oauthSuccessHandler,
            OAuthLoginFailureHandler oauthFailureHandler
    ) {
        this.jwtAuthenticationFilter = jwtAuthenticationFilter;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.accessDeniedHandler = accessDeniedHandler;
        this.oauthProviders = oauthProviders;
        this.oauthSuccessHandler = oauthSuccessHandler;
        this.oauthFailureHandler = oauthFailureHandler;
    }

    @Bean
    public RouteAccessRegistry routeAccessRegistry() {
        return RouteAccessRegistry.builder()
                .route("/admin/**", RouteAccessPolicy.roles("admin"))
                .route(HttpMethod.GET, "/v1/products/**", RouteAccessPolicy.permissions("products:read"))
                .route(HttpMethod.POST, "/v1/products/**",
                        RouteAccessPolicy.permissions("products:create").andRoles("admin", "moderator"))
                .route(HttpMethod.PUT, "/v1/products/**",
                        RouteAccessPolicy.permissions("products:update").andRoles("admin", "moderator"))
                .route(HttpMethod.DELETE, "/v1/products/**",
                        RouteAccessPolicy.permissions("products:delete").andRoles("admin"))
                .route(HttpMethod.POST, "/organizations/**", RouteAccessPolicy.roles("admin"))
                .route(HttpMethod.PATCH, "/organizations/**", RouteAccessPolicy.roles("admin"))
                .route(HttpMethod.DELETE, "/organizations/**", RouteAccessPolicy.roles("admin"))
                .build();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, RouteAccessRegistry routeAccessRegistry) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(authz -> authz
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(HttpMethod.POST,
                                "/auth/register", "/auth/login", "/auth/refresh", "/auth/logout").permitAll()
                        .requestMatchers("/health", "/health/**").permitAll()
                        .requestMatchers("/oauth2/**", "/login/oauth2/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/v1/themes/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().access(new RouteAccessAuthorizationManager(routeAccessRegistry))
                )
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .addFilterBefore(jwtAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);

        if (!oauthProviders.isEmpty()) {
            http.oauth2Login(oauth -> oauth
                    .clientRegistrationRepository(
                            new InMemoryClientRegistrationRepository(oauthProviders.clientRegistrations()))
                    .successHandler(oauthSuccessHandler)
                    .failureHandler(oauthFailureHandler)
            );
        }
        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(Arrays.asList(allowedOrigins.split(",")));
        config.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(Arrays.asList("*"));
        config.setExposedHeaders(Arrays.asList("Authorization", "Location", "X-Request-Id"));
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
