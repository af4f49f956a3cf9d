package com.streamearn.service;

import java.math.BigDecimal;
import java.util.List;

public record DashboardSnapshot(
        String periodKey,
        String tokenSymbol,
        BigDecimal poolTotal,
        BigDecimal poolRemaining,
        BigDecimal poolRemainingPercent,
        BigDecimal dailyEmission,
        BigDecimal expectedDailyEmission,
        long activeIdentitiesToday,
        long settlementsToday,
        int anomalyScore,
        List<DashboardAlert> alerts,
        RewardMetrics.MetricsSnapshot metrics
) {
}
