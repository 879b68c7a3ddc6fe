package com.scaffold.backend.modules.organization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.scaffold.backend.modules.organization.domain.Organization;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

    Optional<Organization> findByCustomerId(String customerId);

    boolean existsByCustomerId(String customerId);

    @EntityGraph(attributePaths = "members")
    @Query("select o from Organization o where o.id = :id")
    Optional<Organization> findWithMembersById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "members")
    @Query("select o from Organization o order by o.createdAt desc")
    List<Organization> findAllWithMembers();
}
