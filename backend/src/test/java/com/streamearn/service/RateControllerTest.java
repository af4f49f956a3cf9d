package com.streamearn.service;

import com.streamearn.config.RateLimitProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateControllerTest {

    private MutableClock clock;
    private RateLimitProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private RateController rateController;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-15T12:00:00Z"));
        properties = new RateLimitProperties();
        meterRegistry = new SimpleMeterRegistry();
        LocalRateLimitStore store = new LocalRateLimitStore(clock);
        rateController = new RateController(store, properties, new RewardMetrics(meterRegistry, store));
    }

    @Test
    void financialRequestsAreThrottledAfterTwentyPerMinute() {
        for (int i = 0; i < 20; i++) {
            RateDecision decision = rateController.admit("wallet-1", EndpointClass.FINANCIAL);
            assertTrue(decision.allowed(), "request " + (i + 1) + " should be admitted");
            assertEquals(19 - i, decision.remaining());
        }
        clock.advance(Duration.ofSeconds(15));

        RateDecision throttled = rateController.admit("wallet-1", EndpointClass.FINANCIAL);

        assertFalse(throttled.allowed());
        assertEquals(45L, throttled.retryAfterSeconds());
        assertEquals(1.0, meterRegistry.get("streamearn.ratelimit.throttled")
                .tag("endpoint_class", "financial").counter().count());
    }

    @Test
    void windowResetsAfterExpiry() {
        for (int i = 0; i < 10; i++) {
            rateController.admit("wallet-1", EndpointClass.AUTHENTICATION);
        }
        assertFalse(rateController.admit("wallet-1", EndpointClass.AUTHENTICATION).allowed());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(rateController.admit("wallet-1", EndpointClass.AUTHENTICATION).allowed());
    }

    @Test
    void endpointClassesAndIdentitiesAreCountedSeparately() {
        for (int i = 0; i < 20; i++) {
            rateController.admit("wallet-1", EndpointClass.FINANCIAL);
        }

        assertFalse(rateController.admit("wallet-1", EndpointClass.FINANCIAL).allowed());
        assertTrue(rateController.admit("wallet-1", EndpointClass.PUBLIC).allowed());
        assertTrue(rateController.admit("wallet-2", EndpointClass.FINANCIAL).allowed());
    }

    @Test
    void storeFailureThrottlesInsteadOfAdmitting() {
        RateLimitStore broken = mock(RateLimitStore.class);
        when(broken.increment(anyString(), any())).thenThrow(new IllegalStateException("store down"));
        RateController failing = new RateController(broken, properties, new RewardMetrics(meterRegistry, broken));

        RateDecision decision = failing.admit("wallet-1", EndpointClass.PUBLIC);

        assertFalse(decision.allowed());
        assertEquals(60L, decision.retryAfterSeconds());
    }

    @Test
    void blankIdentityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> rateController.admit(" ", EndpointClass.PUBLIC));
    }
}
