package com.streamearn.config;

import com.streamearn.service.RateController;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports which store the rate controller is counting in. Running on the local
 * fallback is still UP, since requests keep being limited, but it is flagged.
 */
@Component
public class RateLimitStoreHealthIndicator implements HealthIndicator {

    private final RateController rateController;

    public RateLimitStoreHealthIndicator(RateController rateController) {
        this.rateController = rateController;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("mode", rateController.storeMode())
                .withDetail("degraded", rateController.isDegraded())
                .build();
    }
}
