package com.nnipa.iam.scheduler;

import com.nnipa.iam.service.OneTimeCodeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled task that removes used and expired one-time codes once they leave the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OneTimeCodeCleanupScheduler {

    private final OneTimeCodeService oneTimeCodeService;

    @Value("${security.codes.cleanup-enabled:true}")
    private boolean cleanupEnabled;

    @Scheduled(fixedDelayString = "${security.codes.cleanup-interval:PT1H}")
    public void purgeStaleCodes() {
        if (!cleanupEnabled) {
            log.debug("One-time code cleanup is disabled");
            return;
        }

        try {
            int deleted = oneTimeCodeService.purgeStale();
            if (deleted > 0) {
                log.info("Deleted {} stale one-time codes", deleted);
            } else {
                log.debug("No stale one-time codes found");
            }
        } catch (Exception e) {
            log.error("Error during one-time code cleanup", e);
        }
    }
}
