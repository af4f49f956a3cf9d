package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.SessionStateRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EphemeralStateCleanupServiceTest {

    @Mock
    private SessionStateRepository sessionStateRepository;

    @Mock
    private ContentDailyUsageRepository contentDailyUsageRepository;

    @Test
    void evictsSessionsPastCooldownAndUsageBeforeToday() {
        Instant now = Instant.parse("2026-03-15T12:00:00Z");
        StreamEarnProperties properties = new StreamEarnProperties();
        MutableClock clock = new MutableClock(now.minusSeconds(120));
        LocalRateLimitStore rateLimitStore = new LocalRateLimitStore(clock);
        rateLimitStore.increment("expired", Duration.ofSeconds(60));
        clock.set(now);
        EphemeralStateCleanupService cleanupService = new EphemeralStateCleanupService(
                sessionStateRepository, contentDailyUsageRepository, rateLimitStore, properties,
                new RewardCalendar(Clock.fixed(now, ZoneOffset.UTC), properties));
        when(sessionStateRepository.deleteIdleSince(OffsetDateTime.parse("2026-03-15T11:30:00Z"))).thenReturn(3);
        when(contentDailyUsageRepository.deleteOlderThan(LocalDate.of(2026, 3, 15))).thenReturn(7);

        EphemeralStateCleanupService.CleanupSummary summary = cleanupService.purgeExpired();

        assertEquals(3, summary.sessionsEvicted());
        assertEquals(7, summary.contentUsageEvicted());
        assertEquals(1, summary.rateLimitWindowsEvicted());
        assertTrue(summary.hasWork());
        assertFalse(new EphemeralStateCleanupService.CleanupSummary(0, 0, 0).hasWork());
    }
}
