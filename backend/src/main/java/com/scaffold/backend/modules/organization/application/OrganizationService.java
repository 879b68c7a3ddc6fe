package com.scaffold.backend.modules.organization.application;

import java.util.List;
import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.organization.domain.Organization;
import com.scaffold.backend.modules.organization.infrastructure.persistence.OrganizationRepository;
import com.scaffold.backend.modules.organization.presentation.dto.CreateOrganizationRequest;
import com.scaffold.backend.modules.organization.presentation.dto.OrganizationResponse;
import com.scaffold.backend.modules.organization.presentation.dto.UpdateOrganizationRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final OrganizationRepository organizationRepository;
    private final UserAccountRepository userAccountRepository;

    public OrganizationService(OrganizationRepository organizationRepository, UserAccountRepository userAccountRepository) {
        this.organizationRepository = organizationRepository;
        this.userAccountRepository = userAccountRepository;
    }

    public OrganizationResponse create(CreateOrganizationRequest request) {
        String customerId = request.customerId().trim();
        ensureCustomerIdAvailable(customerId);

        Organization organization = new Organization();
        organization.setCustomerId(customerId);
        organization.setName(request.name().trim());
        organization.setDescription(request.description());
        organization.setTheme(request.theme() != null ? request.theme().toTheme() : null);
        organization.setActive(request.isActive() == null || request.isActive());

        Organization saved = organizationRepository.saveAndFlush(organization);
        log.info("Created organization {} for customer {}", saved.getId(), customerId);
        return OrganizationResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<OrganizationResponse> findAll() {
        return organizationRepository.findAllWithMembers().stream()
                .map(OrganizationResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public OrganizationResponse findOne(UUID id) {
        return OrganizationResponse.from(load(id));
    }

    public OrganizationResponse update(UUID id, UpdateOrganizationRequest request) {
        Organization organization = load(id);
        if (request.customerId() != null) {
            String customerId = request.customerId().trim();
            if (!customerId.equals(organization.getCustomerId())) {
                ensureCustomerIdAvailable(customerId);
                organization.setCustomerId(customerId);
            }
        }
        if (request.name() != null) {
            organization.setName(request.name().trim());
        }
        if (request.description() != null) {
            organization.setDescription(request.description());
        }
        if (request.theme() != null) {
            organization.setTheme(request.theme().toTheme());
        }
        if (request.isActive() != null) {
            organization.setActive(request.isActive());
        }
        return OrganizationResponse.from(organizationRepository.saveAndFlush(organization));
    }

    public void remove(UUID id) {
        organizationRepository.delete(load(id));
        log.info("Removed organization {}", id);
    }

    public OrganizationResponse addMember(UUID organizationId, UUID userId) {
        Organization organization = load(organizationId);
        if (organization.hasMember(userId)) {
            throw ProblemException.conflict("ALREADY_MEMBER", "User is already a member of this organization");
        }
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + userId + " not found"));
        organization.getMembers().add(user);
        log.info("Added user {} to organization {}", userId, organizationId);
        return OrganizationResponse.from(organization);
    }

    public OrganizationResponse removeMember(UUID organizationId, UUID userId) {
        Organization organization = load(organizationId);
        if (organization.getMembers().removeIf(member -> member.getId().equals(userId))) {
            log.info("Removed user {} from organization {}", userId, organizationId);
        }
        return OrganizationResponse.from(organization);
    }

    private void ensureCustomerIdAvailable(String customerId) {
        if (organizationRepository.existsByCustomerId(customerId)) {
            throw ProblemException.conflict(
                    "ORGANIZATION_ALREADY_EXISTS",
                    "Organization with customerId '" + customerId + "' already exists"
            );
        }
    }

    private Organization load(UUID id) {
        return organizationRepository.findWithMembersById(id)
                .orElseThrow(() -> ProblemException.notFound("ORGANIZATION_NOT_FOUND", "Organization with id '" + id + "' not found"));
    }
}
