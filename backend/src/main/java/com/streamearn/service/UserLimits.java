package com.streamearn.service;

import java.util.List;

public record UserLimits(
        String identity,
        SessionPhase sessionPhase,
        long continuousMinutes,
        long listenerSessionCeilingMinutes,
        long artistSessionCeilingMinutes,
        long cooldownRemainingSeconds,
        long contentDailyCeilingMinutes,
        List<ContentUsage> contentUsageToday
) {

    public record ContentUsage(
            String contentId,
            long minutesToday,
            long remainingMinutes
    ) {
    }
}
