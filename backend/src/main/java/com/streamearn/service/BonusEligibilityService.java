package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.RewardAuditEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives bonus eligibility from an identity's committed reward history.
 */
@Service
@RequiredArgsConstructor
public class BonusEligibilityService {

    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final StreamEarnProperties streamEarnProperties;
    private final RewardCalendar rewardCalendar;

    @Transactional(readOnly = true)
    public BonusEligibility resolve(String identity, String contentId, Instant now) {
        StreamEarnProperties.Bonus config = streamEarnProperties.getBonus();
        LocalDate today = rewardCalendar.dateOf(now);

        boolean newIdentity = isEnabled(config.getNewIdentityFraction())
                && isNewIdentity(identity, now, config);
        boolean diversity = isEnabled(config.getDiversityFraction())
                && isContentDiverse(identity, contentId, today, config.getDiversityMinContents());
        boolean streak = isEnabled(config.getStreakFraction())
                && hasStreak(identity, today, config.getStreakMinDays());

        return new BonusEligibility(newIdentity, diversity, streak);
    }

    private boolean isNewIdentity(String identity, Instant now, StreamEarnProperties.Bonus config) {
        Instant windowStart = now.minus(config.getNewIdentityWindow());
        return rewardAuditEntryRepository.findFirstByIdentityOrderByCreatedAtAsc(identity)
                .map(first -> first.getCreatedAt().toInstant().isAfter(windowStart))
                .orElse(true);
    }

    private boolean isContentDiverse(String identity, String contentId, LocalDate today, int minContents) {
        if (minContents <= 0) {
            return false;
        }
        Set<String> contents = new HashSet<>(rewardAuditEntryRepository.findDistinctContentIdsBetween(
                identity,
                rewardCalendar.startOf(today),
                rewardCalendar.startOf(today.plusDays(1))
        ));
        contents.add(contentId);
        return contents.size() >= minContents;
    }

    private boolean hasStreak(String identity, LocalDate today, int minDays) {
        if (minDays <= 0) {
            return false;
        }
        List<OffsetDateTime> rewardTimes = rewardAuditEntryRepository.findCreatedAtBetween(
                identity,
                rewardCalendar.startOf(today.minusDays(minDays)),
                rewardCalendar.startOf(today)
        );
        Set<LocalDate> activeDays = rewardTimes.stream()
                .map(time -> rewardCalendar.dateOf(time.toInstant()))
                .collect(Collectors.toSet());
        for (int daysBack = 1; daysBack <= minDays; daysBack++) {
            if (!activeDays.contains(today.minusDays(daysBack))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEnabled(BigDecimal fraction) {
        return fraction != null && fraction.signum() > 0;
    }
}
