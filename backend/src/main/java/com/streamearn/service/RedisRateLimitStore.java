package com.streamearn.service;

import com.streamearn.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared window store backed by Redis. When Redis fails or times out, requests
 * are counted in the local store and Redis is not retried until the backoff
 * elapses.
 */
@Component
@Primary
@ConditionalOnProperty(
        prefix = "streamearn.rate-limit",
        name = "store",
        havingValue = "redis"
)
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);

    private static final String INCREMENT_LUA = """
            local count = redis.call('INCR', KEYS[1])
            if count == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
                ttl = tonumber(ARGV[1])
            end
            return count .. ':' .. ttl
            """;

    // Replies "<count>:<ttl millis>" so the result reads through the template's string serializer.
    private static final RedisScript<String> INCREMENT_SCRIPT = RedisScript.of(INCREMENT_LUA, String.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final RateLimitProperties rateLimitProperties;
    private final LocalRateLimitStore fallbackStore;
    private final AtomicLong fallbackCount = new AtomicLong();

    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    public RedisRateLimitStore(StringRedisTemplate stringRedisTemplate,
                               RateLimitProperties rateLimitProperties,
                               LocalRateLimitStore fallbackStore) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.rateLimitProperties = rateLimitProperties;
        this.fallbackStore = fallbackStore;
    }

    @Override
    public WindowCount increment(String key, Duration window) {
        if (shouldAttemptRedis()) {
            try {
                WindowCount count = incrementInRedis(key, window);
                if (count != null) {
                    markRedisHealthy();
                    return count;
                }
                log.warn("Redis rate-limit script returned no result, counting request locally");
                markRedisFailure(null);
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
        fallbackCount.incrementAndGet();
        return fallbackStore.increment(key, window);
    }

    @Override
    public String mode() {
        return fallbackMode ? "redis-fallback-local" : "redis";
    }

    @Override
    public boolean isDegraded() {
        return fallbackMode;
    }

    @Override
    public long fallbackCount() {
        return fallbackCount.get();
    }

    private WindowCount incrementInRedis(String key, Duration window) {
        String result = stringRedisTemplate.execute(
                INCREMENT_SCRIPT,
                List.of(key),
                String.valueOf(window.toMillis())
        );
        if (result == null) {
            return null;
        }
        int separator = result.indexOf(':');
        if (separator <= 0) {
            log.warn("Unexpected Redis rate-limit script reply '{}'", result);
            return null;
        }
        long count = Long.parseLong(result.substring(0, separator));
        long ttlMillis = Long.parseLong(result.substring(separator + 1));
        return new WindowCount(count, Duration.ofMillis(Math.max(0L, ttlMillis)));
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + rateLimitProperties.getRedisFailureBackoff().toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis rate-limit store is unavailable; switching to local fallback mode");
            } else {
                log.warn(
                        "Redis rate-limit store is unavailable ({}); switching to local fallback mode",
                        resolveSafeMessage(ex)
                );
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis rate-limit store restored; leaving local fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
