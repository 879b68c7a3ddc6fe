package com.scaffold.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.scaffold.backend.modules.rbac.application.RbacService;
import com.scaffold.backend.modules.rbac.presentation.dto.AssignPermissionsRequest;
import com.scaffold.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.scaffold.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.scaffold.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.scaffold.backend.modules.rbac.presentation.dto.RoleResponse;
import com.scaffold.backend.modules.rbac.presentation.dto.UserRolesResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminRbacController {

    private final RbacService rbacService;

    public AdminRbacController(RbacService rbacService) {
        this.rbacService = rbacService;
    }

    @GetMapping("/roles")
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(rbacService.listRoles());
    }

    @PostMapping("/roles")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(rbacService.createRole(request.name(), request.description()));
    }

    @PostMapping("/permissions")
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(rbacService.createPermission(request.resource(), request.action(), request.description()));
    }

    @PutMapping("/roles/{roleId}/permissions")
    public ResponseEntity<RoleResponse> assignPermissions(
            @PathVariable UUID roleId,
            @Valid @RequestBody AssignPermissionsRequest request
    ) {
        return ResponseEntity.ok(rbacService.assignPermissionsToRole(roleId, request.permissionIds()));
    }

    @PostMapping("/users/{userId}/roles/{roleId}")
    public ResponseEntity<UserRolesResponse> assignRole(@PathVariable UUID userId, @PathVariable UUID roleId) {
        return ResponseEntity.ok(rbacService.assignRoleToUser(userId, roleId));
    }

    @DeleteMapping("/users/{userId}/roles/{roleId}")
    public ResponseEntity<UserRolesResponse> removeRole(@PathVariable UUID userId, @PathVariable UUID roleId) {
        return ResponseEntity.ok(rbacService.removeRoleFromUser(userId, roleId));
    }
}
