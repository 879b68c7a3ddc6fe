package com.scaffold.backend.modules.auth.application.oauth;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scaffold.backend.modules.auth.application.AuthProperties;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.rbac.application.RbacService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps an OAuth identity onto a local account. Each call commits on its own so that a
 * duplicate-key failure from a concurrent callback can be retried as a plain lookup.
 */
@Component
public class OAuthAccountResolver {

    private static final Logger log = LoggerFactory.getLogger(OAuthAccountResolver.class);

    private final UserAccountRepository userAccountRepository;
    private final RbacService rbacService;
    private final AuthProperties properties;
    private final ObjectMapper objectMapper;

    public OAuthAccountResolver(
            UserAccountRepository userAccountRepository,
            RbacService rbacService,
            AuthProperties properties,
            ObjectMapper objectMapper
    ) {
        this.userAccountRepository = userAccountRepository;
        this.rbacService = rbacService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UserAccount resolve(OAuthProfile profile) {
        String email = UserAccount.normalizeEmail(profile.email());
        String profileData = serialize(profile.profileData());

        Optional<UserAccount> linked = userAccountRepository
                .findWithRolesByAuthProviderAndAuthProviderId(profile.provider(), profile.providerId());
        if (linked.isPresent()) {
            UserAccount user = linked.get();
            if (profile.name() != null) {
                user.setName(profile.name());
            }
            user.setAuthProviderData(profileData);
            return userAccountRepository.saveAndFlush(user);
        }

        Optional<UserAccount> sameEmail = userAccountRepository.findWithRolesByEmail(email);
        if (sameEmail.isPresent()) {
            UserAccount user = sameEmail.get();
            user.linkProvider(profile.provider(), profile.providerId(), profileData);
            if (user.getName() == null) {
                user.setName(profile.name());
            }
            log.info("Linked {} identity to existing user {}", profile.provider(), user.getId());
            return userAccountRepository.saveAndFlush(user);
        }

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setName(profile.name());
        user.linkProvider(profile.provider(), profile.providerId(), profileData);
        rbacService.findRoleByName(properties.defaultRole()).ifPresent(user.getRoles()::add);
        UserAccount saved = userAccountRepository.saveAndFlush(user);
        log.info("Created user {} from {} login", saved.getId(), profile.provider());
        return saved;
    }

    private String serialize(Map<String, Object> profileData) {
        if (profileData.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(profileData);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize OAuth profile", ex);
        }
    }
}
