package com.scaffold.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.scaffold.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    @EntityGraph(attributePaths = "permissions")
    @Query("select r from Role r where r.id = :id")
    Optional<Role> findWithPermissionsById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "permissions")
    @Query("select r from Role r order by r.name asc")
    List<Role> findAllWithPermissions();
}
