package com.streamearn.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Token arithmetic shared by the ledger and the wallet store. Amounts carry six
 * decimals and must fit a NUMERIC(30,6) column.
 */
public final class MonetaryAmounts {

    public static final int SCALE = 6;
    public static final BigDecimal MAX_STORABLE = new BigDecimal("999999999999999999999999.999999");

    private MonetaryAmounts() {
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal checkedAdd(String periodKey, BigDecimal left, BigDecimal right) {
        return requireStorable(periodKey, left.add(right));
    }

    public static BigDecimal checkedSubtract(String periodKey, BigDecimal left, BigDecimal right) {
        return requireStorable(periodKey, left.subtract(right));
    }

    private static BigDecimal requireStorable(String periodKey, BigDecimal value) {
        if (value.abs().compareTo(MAX_STORABLE) > 0) {
            throw new InvariantViolationException(periodKey, "Monetary value out of storable range: " + value);
        }
        return normalize(value);
    }
}
