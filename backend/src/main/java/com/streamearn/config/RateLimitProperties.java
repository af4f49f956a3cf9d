package com.streamearn.config;

import com.streamearn.service.EndpointClass;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "streamearn.rate-limit")
public class RateLimitProperties {

    /**
     * Either {@code local} (in-process windows only) or {@code redis} (shared
     * windows with local fallback).
     */
    private String store = "local";
    private String keyPrefix = "streamearn:ratelimit";
    private Duration window = Duration.ofSeconds(60);
    private Duration redisFailureBackoff = Duration.ofSeconds(5);
    private Ceilings ceilings = new Ceilings();

    public long ceilingFor(EndpointClass endpointClass) {
        return switch (endpointClass) {
            case PUBLIC -> ceilings.getPublicEndpoints();
            case AUTHENTICATION -> ceilings.getAuthentication();
            case FINANCIAL -> ceilings.getFinancial();
        };
    }

    @Getter
    @Setter
    public static class Ceilings {
        private long publicEndpoints = 100;
        private long authentication = 10;
        private long financial = 20;
    }
}
