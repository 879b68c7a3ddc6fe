package com.scaffold.backend.modules.organization.application;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.organization.domain.Organization;
import com.scaffold.backend.modules.organization.infrastructure.persistence.OrganizationRepository;
import com.scaffold.backend.modules.organization.presentation.dto.CustomerThemeResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Public theme lookup for the white-label client, keyed by customer id.
 */
@Service
@Transactional(readOnly = true)
public class CustomerThemeService {

    private final OrganizationRepository organizationRepository;

    public CustomerThemeService(OrganizationRepository organizationRepository) {
        this.organizationRepository = organizationRepository;
    }

    public CustomerThemeResponse getCustomerTheme(String customerId) {
        Organization organization = organizationRepository.findByCustomerId(customerId)
                .orElseThrow(() -> ProblemException.notFound(
                        "ORGANIZATION_NOT_FOUND",
                        "No organization found with customerId '" + customerId + "'"
                ));
        if (organization.getTheme() == null) {
            throw ProblemException.notFound(
                    "THEME_NOT_CONFIGURED",
                    "Organization '" + customerId + "' does not have a custom theme configured"
            );
        }
        return CustomerThemeResponse.from(organization);
    }
}
