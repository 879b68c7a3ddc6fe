package com.scaffold.backend.modules.auth.presentation;

import com.scaffold.backend.global.security.SecurityUtils;
import com.scaffold.backend.modules.auth.application.AuthService;
import com.scaffold.backend.modules.auth.application.ClientContext;
import com.scaffold.backend.modules.auth.presentation.dto.AuthResponse;
import com.scaffold.backend.modules.auth.presentation.dto.CurrentUserResponse;
import com.scaffold.backend.modules.auth.presentation.dto.LoginRequest;
import com.scaffold.backend.modules.auth.presentation.dto.MessageResponse;
import com.scaffold.backend.modules.auth.presentation.dto.RefreshTokenRequest;
import com.scaffold.backend.modules.auth.presentation.dto.RegisterRequest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(authService.register(request, ClientContext.from(httpRequest)));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientContext.from(httpRequest)));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken()));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<MessageResponse> logout(@Valid @RequestBody RefreshTokenRequest request) {
        authService.logout(request.refreshToken());
        return ResponseEntity.ok(new MessageResponse("Logged out successfully"));
    }

    @PostMapping("/auth/logout-all")
    public ResponseEntity<Void> logoutAll() {
        authService.logoutEverywhere(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auth/me")
    public ResponseEntity<CurrentUserResponse> me() {
        return ResponseEntity.ok(authService.currentUser(SecurityUtils.getCurrentUserId()));
    }
}
