package com.streamearn.service;

import java.math.BigDecimal;

public record ContentEarnings(
        String contentId,
        long minutes,
        BigDecimal tokensEarned,
        long settlementCount
) {
}
