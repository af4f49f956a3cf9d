package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.RewardAuditEntry;
import com.streamearn.model.SessionState;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.RewardAuditEntryRepository;
import com.streamearn.repository.SessionStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read-only views of one identity's rewards and remaining allowances.
 */
@Service
@RequiredArgsConstructor
public class UserRewardQueryService {

    static final int MAX_HISTORY = 100;
    static final int MAX_TOP_CONTENT = 50;

    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final SessionStateRepository sessionStateRepository;
    private final ContentDailyUsageRepository contentDailyUsageRepository;
    private final AntiFarmPolicyService antiFarmPolicyService;
    private final StreamEarnProperties streamEarnProperties;
    private final RewardCalendar rewardCalendar;

    @Transactional(readOnly = true)
    public List<RewardAuditEntry> history(String identity, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY));
        return rewardAuditEntryRepository.findByIdentityOrderByCreatedAtDesc(identity, PageRequest.of(0, pageSize));
    }

    @Transactional(readOnly = true)
    public UserLimits limits(String identity) {
        Instant now = rewardCalendar.instant();
        LocalDate today = rewardCalendar.dateOf(now);
        StreamEarnProperties.Policy policy = streamEarnProperties.getPolicy();
        long contentCeilingSeconds = policy.getContentDailyCeiling().toSeconds();

        Optional<SessionState> session = sessionStateRepository.findById(identity);
        OffsetDateTime lastActivityAt = session.map(SessionState::getLastActivityAt).orElse(null);
        long continuousSeconds = session.map(SessionState::getContinuousSeconds).orElse(0L);
        SessionPhase phase = antiFarmPolicyService.classify(lastActivityAt, now);
        if (phase == SessionPhase.NEW_SESSION) {
            continuousSeconds = 0L;
        }

        List<UserLimits.ContentUsage> contentUsage = contentDailyUsageRepository
                .findByIdentityAndUsageDate(identity, today)
                .stream()
                .map(usage -> new UserLimits.ContentUsage(
                        usage.getContentId(),
                        usage.getSecondsAccrued() / 60,
                        Math.max(0L, contentCeilingSeconds - usage.getSecondsAccrued()) / 60
                ))
                .toList();

        return new UserLimits(
                identity,
                phase,
                continuousSeconds / 60,
                policy.getListenerSessionCeiling().toMinutes(),
                policy.getArtistSessionCeiling().toMinutes(),
                antiFarmPolicyService.cooldownRemaining(lastActivityAt, now).toSeconds(),
                policy.getContentDailyCeiling().toMinutes(),
                contentUsage
        );
    }

    @Transactional(readOnly = true)
    public RewardStats stats(String identity) {
        LocalDate today = rewardCalendar.today();
        OffsetDateTime tomorrow = rewardCalendar.startOf(today.plusDays(1));
        return new RewardStats(
                identity,
                streamEarnProperties.getTokenSymbol(),
                rewardAuditEntryRepository.sumAmountByIdentity(identity),
                rewardAuditEntryRepository.sumAmountByIdentityBetween(identity, rewardCalendar.startOf(today), tomorrow),
                rewardAuditEntryRepository.sumAmountByIdentityBetween(
                        identity, rewardCalendar.startOf(today.minusDays(6)), tomorrow),
                rewardAuditEntryRepository.sumAmountByIdentityBetween(
                        identity, rewardCalendar.startOf(today.withDayOfMonth(1)), tomorrow)
        );
    }

    /**
     * Content this identity has earned the most on, ranked by rewarded minutes.
     */
    @Transactional(readOnly = true)
    public TopContent topContent(String identity, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_TOP_CONTENT));
        List<ContentEarnings> content = rewardAuditEntryRepository
                .findTopContentByIdentity(identity, PageRequest.of(0, pageSize))
                .stream()
                .map(total -> new ContentEarnings(
                        total.getContentId(),
                        (total.getApprovedSeconds() == null ? 0L : total.getApprovedSeconds()) / 60,
                        MonetaryAmounts.normalize(total.getTotalEarned() == null ? BigDecimal.ZERO : total.getTotalEarned()),
                        total.getSettlementCount() == null ? 0L : total.getSettlementCount()
                ))
                .toList();
        return new TopContent(identity, streamEarnProperties.getTokenSymbol(), content);
    }
}
