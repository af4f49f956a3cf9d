package com.streamearn.service;

import java.util.List;

public record TopEarners(
        EarningsWindow window,
        String tokenSymbol,
        List<TopEarner> earners
) {
}
