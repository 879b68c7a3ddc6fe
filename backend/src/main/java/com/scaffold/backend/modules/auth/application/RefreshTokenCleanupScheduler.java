package com.scaffold.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RefreshTokenCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenCleanupScheduler.class);

    private final RefreshTokenService refreshTokenService;

    public RefreshTokenCleanupScheduler(RefreshTokenService refreshTokenService) {
        this.refreshTokenService = refreshTokenService;
    }

    @Scheduled(
            fixedDelayString = "${app.auth.refresh-cleanup-interval:PT1H}",
            initialDelayString = "${app.auth.refresh-cleanup-interval:PT1H}"
    )
    public void purgeExpiredTokens() {
        int deleted = refreshTokenService.cleanupExpiredTokens();
        if (deleted > 0) {
            log.info("Deleted {} expired refresh tokens", deleted);
        }
    }
}
