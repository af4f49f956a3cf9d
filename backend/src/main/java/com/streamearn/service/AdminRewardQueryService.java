package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.RewardAuditEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Aggregate views over the audit log for operators.
 */
@Service
@RequiredArgsConstructor
public class AdminRewardQueryService {

    static final int TOP_EARNERS_LIMIT = 10;

    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final PoolLedgerService poolLedgerService;
    private final RewardCalendar rewardCalendar;
    private final StreamEarnProperties streamEarnProperties;

    @Transactional(readOnly = true)
    public AdminStats stats() {
        LocalDate today = rewardCalendar.today();
        PoolStatus pool = poolLedgerService.getPoolStatus(rewardCalendar.currentPeriodKey());
        return new AdminStats(
                pool.periodKey(),
                pool.tokenSymbol(),
                rewardAuditEntryRepository.countDistinctIdentitiesBetween(
                        rewardCalendar.startOf(today), rewardCalendar.startOf(today.plusDays(1))),
                rewardAuditEntryRepository.sumAllAmounts(),
                pool.total(),
                pool.remaining(),
                pool.remainingPercent()
        );
    }

    /**
     * Highest earners from the start of the window's first day through the end of today.
     */
    @Transactional(readOnly = true)
    public TopEarners topEarners(EarningsWindow window) {
        LocalDate today = rewardCalendar.today();
        OffsetDateTime from = rewardCalendar.startOf(today.minusDays(window.daysBack()));
        OffsetDateTime to = rewardCalendar.startOf(today.plusDays(1));

        List<TopEarner> earners = rewardAuditEntryRepository
                .findTopEarnersBetween(from, to, PageRequest.of(0, TOP_EARNERS_LIMIT))
                .stream()
                .map(total -> new TopEarner(
                        total.getIdentity(),
                        MonetaryAmounts.normalize(orZero(total.getTotalEarned())),
                        nullToZero(total.getSettlementCount()),
                        nullToZero(total.getApprovedSeconds()) / 60
                ))
                .toList();
        return new TopEarners(window, streamEarnProperties.getTokenSymbol(), earners);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
