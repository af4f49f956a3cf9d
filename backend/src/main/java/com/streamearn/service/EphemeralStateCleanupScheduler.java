package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EphemeralStateCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(EphemeralStateCleanupScheduler.class);

    private final StreamEarnProperties streamEarnProperties;
    private final EphemeralStateCleanupService ephemeralStateCleanupService;

    @Scheduled(
            fixedRateString = "${streamearn.cleanup.interval-ms:300000}",
            initialDelayString = "${streamearn.cleanup.initial-delay-ms:60000}"
    )
    public void purgeExpiredState() {
        if (!streamEarnProperties.getCleanup().isEnabled()) {
            return;
        }

        EphemeralStateCleanupService.CleanupSummary summary = ephemeralStateCleanupService.purgeExpired();
        if (summary.hasWork()) {
            log.info(
                    "Ephemeral state cleanup: sessionsEvicted={}, contentUsageEvicted={}, rateLimitWindowsEvicted={}",
                    summary.sessionsEvicted(),
                    summary.contentUsageEvicted(),
                    summary.rateLimitWindowsEvicted()
            );
        } else {
            log.debug("Ephemeral state cleanup completed with nothing to evict");
        }
    }
}
