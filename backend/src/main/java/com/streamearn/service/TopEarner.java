package com.streamearn.service;

import java.math.BigDecimal;

public record TopEarner(
        String identity,
        BigDecimal totalEarned,
        long settlementCount,
        long minutes
) {
}
