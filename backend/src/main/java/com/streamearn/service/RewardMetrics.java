package com.streamearn.service;

import com.streamearn.model.RewardRole;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters for the reward path. Observes outcomes only; nothing here takes part
 * in a settlement transaction.
 */
@Component
public class RewardMetrics {

    private final Map<RewardRole, Counter> rewardsIssued = new EnumMap<>(RewardRole.class);
    private final Map<RewardRole, Counter> tokensIssued = new EnumMap<>(RewardRole.class);
    private final Map<RejectionReason, Counter> rejections = new EnumMap<>(RejectionReason.class);
    private final Map<EndpointClass, Counter> throttles = new EnumMap<>(EndpointClass.class);
    private final AtomicReference<BigDecimal> tokensIssuedExact = new AtomicReference<>(BigDecimal.ZERO);
    private final RateLimitStore rateLimitStore;

    public RewardMetrics(MeterRegistry meterRegistry, RateLimitStore rateLimitStore) {
        this.rateLimitStore = rateLimitStore;
        for (RewardRole role : RewardRole.values()) {
            String tag = role.name().toLowerCase(Locale.ROOT);
            rewardsIssued.put(role, Counter.builder("streamearn.rewards.issued")
                    .description("Committed reward payouts")
                    .tag("role", tag)
                    .register(meterRegistry));
            tokensIssued.put(role, Counter.builder("streamearn.rewards.tokens")
                    .description("Tokens paid out by committed rewards")
                    .tag("role", tag)
                    .register(meterRegistry));
        }
        for (RejectionReason reason : RejectionReason.values()) {
            rejections.put(reason, Counter.builder("streamearn.rewards.rejected")
                    .description("Reward requests rejected, by reason")
                    .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                    .tag("category", reason.category().name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        for (EndpointClass endpointClass : EndpointClass.values()) {
            throttles.put(endpointClass, Counter.builder("streamearn.ratelimit.throttled")
                    .description("Requests refused by the rate controller")
                    .tag("endpoint_class", endpointClass.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        FunctionCounter.builder("streamearn.ratelimit.fallbacks", rateLimitStore, RateLimitStore::fallbackCount)
                .description("Requests counted locally because the shared store was unavailable")
                .register(meterRegistry);
        Gauge.builder("streamearn.ratelimit.degraded", rateLimitStore, store -> store.isDegraded() ? 1.0 : 0.0)
                .description("1 while the rate controller runs on its local fallback")
                .register(meterRegistry);
    }

    public void recordPaid(RewardRole role, BigDecimal amount) {
        rewardsIssued.get(role).increment();
        tokensIssued.get(role).increment(amount.doubleValue());
        tokensIssuedExact.accumulateAndGet(amount, BigDecimal::add);
    }

    public void recordRejected(RejectionReason reason) {
        rejections.get(reason).increment();
    }

    public void recordThrottled(EndpointClass endpointClass) {
        throttles.get(endpointClass).increment();
    }

    public MetricsSnapshot snapshot() {
        long issued = 0L;
        for (Counter counter : rewardsIssued.values()) {
            issued += (long) counter.count();
        }
        Map<RejectionReason, Long> rejectionCounts = new EnumMap<>(RejectionReason.class);
        rejections.forEach((reason, counter) -> rejectionCounts.put(reason, (long) counter.count()));
        Map<EndpointClass, Long> throttleCounts = new EnumMap<>(EndpointClass.class);
        throttles.forEach((endpointClass, counter) -> throttleCounts.put(endpointClass, (long) counter.count()));
        return new MetricsSnapshot(
                issued,
                tokensIssuedExact.get(),
                Collections.unmodifiableMap(rejectionCounts),
                Collections.unmodifiableMap(throttleCounts),
                rateLimitStore.fallbackCount(),
                rateLimitStore.isDegraded()
        );
    }

    public record MetricsSnapshot(
            long rewardsIssued,
            BigDecimal tokensIssued,
            Map<RejectionReason, Long> rejections,
            Map<EndpointClass, Long> throttles,
            long rateLimitFallbacks,
            boolean rateLimitDegraded
    ) {
    }
}
