package com.streamearn.service;

import java.time.Duration;

public record RateDecision(
        boolean allowed,
        long remaining,
        Duration retryAfter
) {

    public static RateDecision allowed(long remaining) {
        return new RateDecision(true, remaining, Duration.ZERO);
    }

    public static RateDecision throttled(Duration retryAfter) {
        return new RateDecision(false, 0L, retryAfter);
    }

    /**
     * Retry-After in whole seconds, rounded up and never below one.
     */
    public long retryAfterSeconds() {
        long millis = retryAfter.toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
