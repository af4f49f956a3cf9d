package com.streamearn.service;

import com.streamearn.model.MonthlyPool;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record PoolStatus(
        String periodKey,
        String tokenSymbol,
        BigDecimal total,
        BigDecimal remaining,
        BigDecimal remainingPercent,
        BigDecimal artistAllocation,
        BigDecimal listenerAllocation,
        BigDecimal artistSpent,
        BigDecimal listenerSpent,
        boolean halted,
        String haltReason
) {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public static PoolStatus from(MonthlyPool pool) {
        return new PoolStatus(
                pool.getPeriodKey(),
                pool.getTokenSymbol(),
                pool.getTotalAmount(),
                pool.getRemainingAmount(),
                percentOf(pool.getRemainingAmount(), pool.getTotalAmount()),
                pool.getArtistAllocation(),
                pool.getListenerAllocation(),
                pool.getArtistSpent(),
                pool.getListenerSpent(),
                pool.isHalted(),
                pool.getHaltReason()
        );
    }

    static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return part.multiply(ONE_HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
    }
}
