package com.streamearn.service;

import java.math.BigDecimal;

public record PricedReward(
        BigDecimal amount,
        long pricedSeconds,
        BigDecimal bonusMultiplier
) {
}
