package com.streamearn.service;

import com.streamearn.model.RewardRole;

import java.math.BigDecimal;

public record SettlementRequest(
        String identity,
        RewardRole role,
        String contentId,
        BigDecimal amount,
        String periodKey,
        long approvedSeconds,
        BigDecimal bonusMultiplier
) {
}
