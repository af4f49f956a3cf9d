package com.streamearn.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Economic and anti-abuse parameters of the Stream-to-Earn settlement core.
 * Every threshold the reward path consults lives here so that operators can
 * retune a period without a redeploy.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "streamearn")
public class StreamEarnProperties {

    /**
     * Symbol of the native token credited to wallets.
     */
    private String tokenSymbol = "DYO";

    /**
     * Zone used to derive period keys and calendar days.
     */
    private ZoneId zone = ZoneId.of("UTC");

    private Pool pool = new Pool();
    private Rates rates = new Rates();
    private Policy policy = new Policy();
    private Bonus bonus = new Bonus();
    private Amount amount = new Amount();
    private Settlement settlement = new Settlement();
    private Dashboard dashboard = new Dashboard();
    private Cleanup cleanup = new Cleanup();

    @Getter
    @Setter
    public static class Pool {
        private BigDecimal openingAllocation = new BigDecimal("2000000.000000");
        /**
         * Fraction of the opening allocation reserved for artist rewards; the
         * remainder goes to listeners.
         */
        private BigDecimal artistShare = new BigDecimal("0.60");
        private int lowWaterPercent = 20;
    }

    @Getter
    @Setter
    public static class Rates {
        private BigDecimal listenerPerMinute = new BigDecimal("0.10");
        private BigDecimal artistPerMinute = new BigDecimal("0.50");
    }

    @Getter
    @Setter
    public static class Policy {
        private Duration cooldown = Duration.ofMinutes(30);
        private Duration sessionIdleTimeout = Duration.ofMinutes(10);
        private Duration listenerSessionCeiling = Duration.ofMinutes(90);
        private Duration artistSessionCeiling = Duration.ofMinutes(120);
        private Duration contentDailyCeiling = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Bonus {
        private BigDecimal newIdentityFraction = new BigDecimal("0.10");
        private Duration newIdentityWindow = Duration.ofDays(7);
        private BigDecimal diversityFraction = new BigDecimal("0.05");
        private int diversityMinContents = 3;
        private BigDecimal streakFraction = new BigDecimal("0.05");
        private int streakMinDays = 3;
    }

    @Getter
    @Setter
    public static class Amount {
        private BigDecimal minimum = new BigDecimal("0.01");
        /**
         * Optional per-reward ceiling. Unset means no ceiling.
         */
        private BigDecimal maximum;
    }

    @Getter
    @Setter
    public static class Settlement {
        private int timeoutSeconds = 5;
    }

    @Getter
    @Setter
    public static class Dashboard {
        private BigDecimal emissionAlertMultiple = new BigDecimal("1.5");
        private int anomalyAlertThreshold = 50;
        private Duration heavyUsage = Duration.ofMinutes(90);
    }

    @Getter
    @Setter
    public static class Cleanup {
        private boolean enabled = true;
        private long initialDelayMs = 60_000;
        private long intervalMs = 300_000;
    }
}
