package com.streamearn.service;

import java.math.BigDecimal;

public record RewardStats(
        String identity,
        String tokenSymbol,
        BigDecimal totalEarned,
        BigDecimal earnedToday,
        BigDecimal earnedThisWeek,
        BigDecimal earnedThisMonth
) {
}
