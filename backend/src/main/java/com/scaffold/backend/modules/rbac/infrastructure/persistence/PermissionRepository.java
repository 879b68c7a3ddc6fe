package com.scaffold.backend.modules.rbac.infrastructure.persistence;

import java.util.UUID;

import com.scaffold.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    boolean existsByResourceAndAction(String resource, String action);
}
