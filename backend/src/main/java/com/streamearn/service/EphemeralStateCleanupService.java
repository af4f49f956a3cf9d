package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.SessionStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

/**
 * Evicts per-identity state whose governing window has passed. A session idle
 * for longer than the cooldown would be reset by the next activity anyway, and
 * content usage only matters for the current day.
 */
@Service
@RequiredArgsConstructor
public class EphemeralStateCleanupService {

    private final SessionStateRepository sessionStateRepository;
    private final ContentDailyUsageRepository contentDailyUsageRepository;
    private final LocalRateLimitStore localRateLimitStore;
    private final StreamEarnProperties streamEarnProperties;
    private final RewardCalendar rewardCalendar;

    @Transactional
    public CleanupSummary purgeExpired() {
        OffsetDateTime now = rewardCalendar.now();
        OffsetDateTime sessionCutoff = now.minus(streamEarnProperties.getPolicy().getCooldown());
        int sessions = sessionStateRepository.deleteIdleSince(sessionCutoff);
        int usageRows = contentDailyUsageRepository.deleteOlderThan(rewardCalendar.today());
        int windows = localRateLimitStore.purgeExpired();
        return new CleanupSummary(sessions, usageRows, windows);
    }

    public record CleanupSummary(
            int sessionsEvicted,
            int contentUsageEvicted,
            int rateLimitWindowsEvicted
    ) {
        public boolean hasWork() {
            return sessionsEvicted > 0 || contentUsageEvicted > 0 || rateLimitWindowsEvicted > 0;
        }
    }
}
