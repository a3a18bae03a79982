package com.xammer.iamrisk.service.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScanSessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(ScanSessionSweeper.class);

    private final ScanSessionStore sessionStore;

    public ScanSessionSweeper(ScanSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedRateString = "${risk.scan-session.sweep-interval-ms:300000}")
    public void purgeExpiredSessions() {
        int removed = sessionStore.purgeExpired();
        if (removed > 0) {
            logger.info("Purged {} expired scan sessions", removed);
        } else {
            logger.debug("No expired scan sessions to purge");
        }
    }
}
