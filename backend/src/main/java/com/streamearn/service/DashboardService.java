package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.RewardAuditEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator view over the current period: pool health, today's emission and an
 * anomaly score that flags farming-like usage.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final PoolLedgerService poolLedgerService;
    private final RewardAuditEntryRepository rewardAuditEntryRepository;
    private final ContentDailyUsageRepository contentDailyUsageRepository;
    private final RewardMetrics rewardMetrics;
    private final RewardCalendar rewardCalendar;
    private final StreamEarnProperties streamEarnProperties;

    @Transactional(readOnly = true)
    public DashboardSnapshot getDashboardSnapshot() {
        String periodKey = rewardCalendar.currentPeriodKey();
        LocalDate today = rewardCalendar.today();
        OffsetDateTime from = rewardCalendar.startOf(today);
        OffsetDateTime to = rewardCalendar.startOf(today.plusDays(1));

        PoolStatus pool = poolLedgerService.getPoolStatus(periodKey);
        BigDecimal dailyEmission = rewardAuditEntryRepository.sumAmountBetween(from, to);
        long activeIdentities = rewardAuditEntryRepository.countDistinctIdentitiesBetween(from, to);
        long settlementsToday = rewardAuditEntryRepository.countBetween(from, to);

        long heavyUsageSeconds = streamEarnProperties.getDashboard().getHeavyUsage().toSeconds();
        List<ContentDailyUsageRepository.IdentityUsageTotal> usage =
                contentDailyUsageRepository.sumSecondsByIdentityOn(today);
        long heavyIdentities = usage.stream()
                .filter(total -> total.getSecondsAccrued() != null && total.getSecondsAccrued() >= heavyUsageSeconds)
                .count();

        int anomalyScore = anomalyScore(usage.size(), heavyIdentities, activeIdentities, settlementsToday);
        int daysInPeriod = rewardCalendar.parsePeriodKey(periodKey).lengthOfMonth();
        BigDecimal expectedDailyEmission = pool.total()
                .divide(BigDecimal.valueOf(daysInPeriod), MonetaryAmounts.SCALE, RoundingMode.DOWN);

        return new DashboardSnapshot(
                periodKey,
                pool.tokenSymbol(),
                pool.total(),
                pool.remaining(),
                pool.remainingPercent(),
                dailyEmission,
                expectedDailyEmission,
                activeIdentities,
                settlementsToday,
                anomalyScore,
                alerts(pool, dailyEmission, expectedDailyEmission, anomalyScore),
                rewardMetrics.snapshot()
        );
    }

    /**
     * Score in [0, 100]. Half of it comes from the share of identities that
     * reached the heavy-usage mark today, the rest from settlements per identity.
     */
    static int anomalyScore(long identitiesWithUsage, long heavyIdentities, long rewardedIdentities, long settlements) {
        int score = 0;
        if (identitiesWithUsage > 0) {
            double heavyShare = (double) heavyIdentities / identitiesWithUsage;
            if (heavyShare > 0.8) {
                score += 50;
            } else if (heavyShare > 0.5) {
                score += 25;
            }
        }
        if (rewardedIdentities > 0) {
            double settlementsPerIdentity = (double) settlements / rewardedIdentities;
            if (settlementsPerIdentity > 20) {
                score += 30;
            } else if (settlementsPerIdentity > 10) {
                score += 15;
            }
        }
        return Math.min(score, 100);
    }

    private List<DashboardAlert> alerts(PoolStatus pool,
                                        BigDecimal dailyEmission,
                                        BigDecimal expectedDailyEmission,
                                        int anomalyScore) {
        StreamEarnProperties.Dashboard thresholds = streamEarnProperties.getDashboard();
        List<DashboardAlert> alerts = new ArrayList<>();
        if (pool.halted()) {
            alerts.add(new DashboardAlert(DashboardAlert.Type.POOL_HALTED,
                    "Reward pool " + pool.periodKey() + " is halted: " + pool.haltReason()));
        }
        BigDecimal lowWater = BigDecimal.valueOf(streamEarnProperties.getPool().getLowWaterPercent());
        if (pool.remainingPercent().compareTo(lowWater) < 0) {
            alerts.add(new DashboardAlert(DashboardAlert.Type.LOW_POOL_BALANCE,
                    "Reward pool below " + lowWater + "%: " + pool.remainingPercent() + "% remaining"));
        }
        BigDecimal emissionLimit = expectedDailyEmission.multiply(thresholds.getEmissionAlertMultiple());
        if (dailyEmission.compareTo(emissionLimit) > 0) {
            alerts.add(new DashboardAlert(DashboardAlert.Type.HIGH_DAILY_EMISSION,
                    "Daily emission " + dailyEmission + " exceeds " + emissionLimit));
        }
        if (anomalyScore > thresholds.getAnomalyAlertThreshold()) {
            alerts.add(new DashboardAlert(DashboardAlert.Type.ANOMALY_DETECTED,
                    "Anomaly score " + anomalyScore + " exceeds " + thresholds.getAnomalyAlertThreshold()));
        }
        return List.copyOf(alerts);
    }
}
