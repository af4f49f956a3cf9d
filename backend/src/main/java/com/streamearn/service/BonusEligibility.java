package com.streamearn.service;

/**
 * Which reward bonuses an activity qualifies for. Each flag is evaluated
 * independently of the others.
 */
public record BonusEligibility(
        boolean newIdentity,
        boolean contentDiversity,
        boolean activityStreak
) {

    public static BonusEligibility none() {
        return new BonusEligibility(false, false, false);
    }
}
