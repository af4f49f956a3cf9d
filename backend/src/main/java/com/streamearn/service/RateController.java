package com.streamearn.service;

import com.streamearn.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Admits or throttles requests per (identity, endpoint class) in fixed windows.
 * Never fails open: when no store can count the request, it is throttled.
 */
@Service
public class RateController {

    private static final Logger log = LoggerFactory.getLogger(RateController.class);

    private final RateLimitStore rateLimitStore;
    private final RateLimitProperties rateLimitProperties;
    private final RewardMetrics rewardMetrics;

    public RateController(RateLimitStore rateLimitStore,
                          RateLimitProperties rateLimitProperties,
                          RewardMetrics rewardMetrics) {
        this.rateLimitStore = rateLimitStore;
        this.rateLimitProperties = rateLimitProperties;
        this.rewardMetrics = rewardMetrics;
    }

    public RateDecision admit(String identity, EndpointClass endpointClass) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        long ceiling = rateLimitProperties.ceilingFor(endpointClass);
        Duration window = rateLimitProperties.getWindow();
        String key = rateLimitProperties.getKeyPrefix() + ":"
                + endpointClass.name().toLowerCase(Locale.ROOT) + ":" + identity;

        RateLimitStore.WindowCount count;
        try {
            count = rateLimitStore.increment(key, window);
        } catch (RuntimeException ex) {
            log.error("Rate limit store failed for {} request from {}; throttling", endpointClass, identity, ex);
            rewardMetrics.recordThrottled(endpointClass);
            return RateDecision.throttled(window);
        }

        if (count.count() > ceiling) {
            rewardMetrics.recordThrottled(endpointClass);
            log.debug("Throttled {} request from {}: count={}, ceiling={}", endpointClass, identity, count.count(), ceiling);
            return RateDecision.throttled(count.resetIn());
        }
        return RateDecision.allowed(ceiling - count.count());
    }

    public String storeMode() {
        return rateLimitStore.mode();
    }

    public boolean isDegraded() {
        return rateLimitStore.isDegraded();
    }
}
