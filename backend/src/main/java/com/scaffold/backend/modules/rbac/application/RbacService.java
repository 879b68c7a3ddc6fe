package com.scaffold.backend.modules.rbac.application;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.rbac.domain.Permission;
import com.scaffold.backend.modules.rbac.domain.Role;
import com.scaffold.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.scaffold.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.scaffold.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.scaffold.backend.modules.rbac.presentation.dto.RoleResponse;
import com.scaffold.backend.modules.rbac.presentation.dto.UserRolesResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RbacService {

    private static final Logger log = LoggerFactory.getLogger(RbacService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserAccountRepository userAccountRepository;

    public RbacService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            UserAccountRepository userAccountRepository
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.userAccountRepository = userAccountRepository;
    }

    public RoleResponse createRole(String name, String description) {
        String roleName = name.trim();
        if (roleRepository.existsByName(roleName)) {
            throw ProblemException.conflict("ROLE_ALREADY_EXISTS", "Role " + roleName + " already exists");
        }
        Role role = roleRepository.save(new Role(roleName, description));
        log.info("Created role {}", roleName);
        return RoleResponse.from(role);
    }

    public PermissionResponse createPermission(String resource, String action, String description) {
        String normalizedResource = resource.trim();
        String normalizedAction = action.trim();
        if (permissionRepository.existsByResourceAndAction(normalizedResource, normalizedAction)) {
            throw ProblemException.conflict(
                    "PERMISSION_ALREADY_EXISTS",
                    "Permission " + normalizedResource + ":" + normalizedAction + " already exists"
            );
        }
        Permission permission = permissionRepository.save(
                new Permission(normalizedResource, normalizedAction, description));
        log.info("Created permission {}", permission.getName());
        return PermissionResponse.from(permission);
    }

    /**
     * Replaces the role's permission set with exactly the given permissions.
     */
    public RoleResponse assignPermissionsToRole(UUID roleId, List<UUID> permissionIds) {
        Role role = roleRepository.findWithPermissionsById(roleId)
                .orElseThrow(() -> roleNotFound(roleId));

        Set<UUID> requested = new LinkedHashSet<>(permissionIds);
        List<Permission> permissions = permissionRepository.findAllById(requested);
        if (permissions.size() != requested.size()) {
            throw ProblemException.notFound("PERMISSION_NOT_FOUND", "One or more permissions were not found");
        }

        role.replacePermissions(permissions);
        return RoleResponse.from(role);
    }

    public UserRolesResponse assignRoleToUser(UUID userId, UUID roleId) {
        UserAccount user = loadUser(userId);
        Role role = roleRepository.findById(roleId).orElseThrow(() -> roleNotFound(roleId));
        if (user.getRoles().stream().noneMatch(existing -> existing.getId().equals(role.getId()))) {
            user.getRoles().add(role);
            log.info("Granted role {} to user {}", role.getName(), userId);
        }
        return toUserRoles(user);
    }

    public UserRolesResponse removeRoleFromUser(UUID userId, UUID roleId) {
        UserAccount user = loadUser(userId);
        if (user.getRoles().removeIf(existing -> existing.getId().equals(roleId))) {
            log.info("Revoked role {} from user {}", roleId, userId);
        }
        return toUserRoles(user);
    }

    @Transactional(readOnly = true)
    public Optional<Role> findRoleByName(String name) {
        return roleRepository.findByName(name);
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        return roleRepository.findAllWithPermissions().stream()
                .map(RoleResponse::from)
                .toList();
    }

    private UserAccount loadUser(UUID userId) {
        return userAccountRepository.findWithRolesById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + userId + " not found"));
    }

    private static UserRolesResponse toUserRoles(UserAccount user) {
        List<String> roles = user.getRoles().stream()
                .map(Role::getName)
                .sorted(Comparator.naturalOrder())
                .toList();
        return new UserRolesResponse(user.getId(), roles);
    }

    private static ProblemException roleNotFound(UUID roleId) {
        return ProblemException.notFound("ROLE_NOT_FOUND", "Role " + roleId + " not found");
    }
}
