package com.streamearn.service;

import java.math.BigDecimal;

/**
 * Operator headline numbers: today's participation, lifetime emission and the
 * state of the current pool.
 */
public record AdminStats(
        String periodKey,
        String tokenSymbol,
        long activeIdentitiesToday,
        BigDecimal distributedAllTime,
        BigDecimal poolTotal,
        BigDecimal poolRemaining,
        BigDecimal poolRemainingPercent
) {
}
