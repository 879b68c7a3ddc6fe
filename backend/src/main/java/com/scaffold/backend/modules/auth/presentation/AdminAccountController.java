package com.scaffold.backend.modules.auth.presentation;

import java.util.UUID;

import com.scaffold.backend.modules.auth.application.AccountAdministrationService;
import com.scaffold.backend.modules.auth.presentation.dto.RevokedSessionsResponse;
import com.scaffold.backend.modules.auth.presentation.dto.UpdateUserStatusRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users/{userId}")
public class AdminAccountController {

    private final AccountAdministrationService accountAdministrationService;

    public AdminAccountController(AccountAdministrationService accountAdministrationService) {
        this.accountAdministrationService = accountAdministrationService;
    }

    @PatchMapping("/status")
    public ResponseEntity<Void> updateStatus(@PathVariable UUID userId, @Valid @RequestBody UpdateUserStatusRequest request) {
        accountAdministrationService.updateStatus(userId, request.active());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sessions/revoke")
    public ResponseEntity<RevokedSessionsResponse> revokeSessions(@PathVariable UUID userId) {
        return ResponseEntity.ok(accountAdministrationService.revokeSessions(userId));
    }
}
