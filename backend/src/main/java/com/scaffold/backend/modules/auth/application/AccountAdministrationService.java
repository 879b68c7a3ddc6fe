package com.scaffold.backend.modules.auth.application;

import java.util.UUID;

import com.scaffold.backend.global.error.ProblemException;
import com.scaffold.backend.modules.auth.domain.UserAccount;
import com.scaffold.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.scaffold.backend.modules.auth.presentation.dto.RevokedSessionsResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative account actions. Accounts are never deleted, only deactivated.
 */
@Service
@Transactional
public class AccountAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(AccountAdministrationService.class);

    private final UserAccountRepository userAccountRepository;
    private final RefreshTokenService refreshTokenService;

    public AccountAdministrationService(UserAccountRepository userAccountRepository, RefreshTokenService refreshTokenService) {
        this.userAccountRepository = userAccountRepository;
        this.refreshTokenService = refreshTokenService;
    }

    /**
     * Deactivating an account also revokes its refresh tokens.
     */
    public void updateStatus(UUID userId, boolean active) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + userId + " not found"));
        if (user.isActive() == active) {
            return;
        }
        user.setActive(active);
        if (!active) {
            refreshTokenService.revokeAllUserTokens(userId);
        }
        log.info("User {} is now {}", userId, active ? "active" : "inactive");
    }

    public RevokedSessionsResponse revokeSessions(UUID userId) {
        if (!userAccountRepository.existsById(userId)) {
            throw ProblemException.notFound("USER_NOT_FOUND", "User " + userId + " not found");
        }
        return new RevokedSessionsResponse(userId, refreshTokenService.revokeAllUserTokens(userId));
    }
}
