package com.scaffold.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.scaffold.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    boolean existsByEmail(String email);

    @EntityGraph(attributePaths = {"roles", "roles.permissions"})
    Optional<UserAccount> findWithRolesByEmail(String email);

    @EntityGraph(attributePaths = {"roles", "roles.permissions"})
    Optional<UserAccount> findWithRolesByAuthProviderAndAuthProviderId(String authProvider, String authProviderId);

    @EntityGraph(attributePaths = {"roles", "roles.permissions"})
    @Query("select u from UserAccount u where u.id = :id")
    Optional<UserAccount> findWithRolesById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"roles", "roles.permissions"})
    @Query("select u from UserAccount u where u.id = :id and u.active = true")
    Optional<UserAccount> findActiveWithRolesById(@Param("id") UUID id);
}
