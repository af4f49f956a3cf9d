package com.streamearn.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process window store. Used on its own in single-instance deployments and
 * as the fallback when the shared store is unreachable.
 */
@Component
public class LocalRateLimitStore implements RateLimitStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public LocalRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WindowCount increment(String key, Duration window) {
        long nowMillis = clock.millis();
        Window updated = windows.compute(key, (ignored, existing) -> {
            if (existing == null || existing.expiresAtMillis() <= nowMillis) {
                return new Window(nowMillis + window.toMillis(), 1L);
            }
            return new Window(existing.expiresAtMillis(), existing.count() + 1L);
        });
        return new WindowCount(updated.count(), Duration.ofMillis(updated.expiresAtMillis() - nowMillis));
    }

    @Override
    public String mode() {
        return "local";
    }

    /**
     * Drop windows that have already expired.
     *
     * @return number of windows removed
     */
    public int purgeExpired() {
        long nowMillis = clock.millis();
        int before = windows.size();
        windows.values().removeIf(window -> window.expiresAtMillis() <= nowMillis);
        return Math.max(0, before - windows.size());
    }

    int size() {
        return windows.size();
    }

    private record Window(long expiresAtMillis, long count) {
    }
}
