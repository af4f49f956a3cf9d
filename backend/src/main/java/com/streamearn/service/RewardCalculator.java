package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.RewardRole;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices approved activity in tokens.
 *
 * amount = rate(role) x minutes x bonusMultiplier
 *
 * Bonuses compose multiplicatively in a fixed order: new identity, content
 * diversity, activity streak. The raw amount is rounded down to six decimals,
 * then raised to the floor, then capped at the ceiling when one is configured.
 */
@Component
public class RewardCalculator {

    private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

    private final StreamEarnProperties streamEarnProperties;

    public RewardCalculator(StreamEarnProperties streamEarnProperties) {
        this.streamEarnProperties = streamEarnProperties;
    }

    /**
     * @param requestedSeconds duration the client reported
     * @param approvedSeconds duration the policy engine approved; pricing never exceeds it
     */
    public PricedReward price(RewardRole role, long requestedSeconds, long approvedSeconds, BonusEligibility bonuses) {
        if (requestedSeconds <= 0 || approvedSeconds <= 0) {
            throw new IllegalArgumentException("Priced duration must be positive");
        }
        long pricedSeconds = Math.min(requestedSeconds, approvedSeconds);
        BigDecimal multiplier = bonusMultiplier(bonuses);

        BigDecimal raw = baseRate(role)
                .multiply(BigDecimal.valueOf(pricedSeconds))
                .multiply(multiplier)
                .divide(SECONDS_PER_MINUTE, MonetaryAmounts.SCALE, RoundingMode.DOWN);

        return new PricedReward(clamp(raw), pricedSeconds, multiplier);
    }

    public BigDecimal bonusMultiplier(BonusEligibility bonuses) {
        StreamEarnProperties.Bonus config = streamEarnProperties.getBonus();
        BigDecimal multiplier = BigDecimal.ONE;
        if (bonuses.newIdentity()) {
            multiplier = multiplier.multiply(BigDecimal.ONE.add(config.getNewIdentityFraction()));
        }
        if (bonuses.contentDiversity()) {
            multiplier = multiplier.multiply(BigDecimal.ONE.add(config.getDiversityFraction()));
        }
        if (bonuses.activityStreak()) {
            multiplier = multiplier.multiply(BigDecimal.ONE.add(config.getStreakFraction()));
        }
        return multiplier.setScale(MonetaryAmounts.SCALE, RoundingMode.DOWN);
    }

    private BigDecimal baseRate(RewardRole role) {
        StreamEarnProperties.Rates rates = streamEarnProperties.getRates();
        return role == RewardRole.ARTIST ? rates.getArtistPerMinute() : rates.getListenerPerMinute();
    }

    private BigDecimal clamp(BigDecimal raw) {
        StreamEarnProperties.Amount bounds = streamEarnProperties.getAmount();
        BigDecimal amount = raw;
        if (bounds.getMinimum() != null && amount.compareTo(bounds.getMinimum()) < 0) {
            amount = bounds.getMinimum();
        }
        if (bounds.getMaximum() != null && amount.compareTo(bounds.getMaximum()) > 0) {
            amount = bounds.getMaximum();
        }
        return MonetaryAmounts.normalize(amount);
    }
}
