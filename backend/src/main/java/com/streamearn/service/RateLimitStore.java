package com.streamearn.service;

import java.time.Duration;

/**
 * Fixed-window request counter.
 */
public interface RateLimitStore {

    /**
     * Count one request against {@code key}. A window starts with the first
     * request after the previous one expired and lasts {@code window}.
     */
    WindowCount increment(String key, Duration window);

    String mode();

    default boolean isDegraded() {
        return false;
    }

    default long fallbackCount() {
        return 0L;
    }

    record WindowCount(long count, Duration resetIn) {
    }
}
