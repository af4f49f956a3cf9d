package com.streamearn.service;

import com.streamearn.model.RewardRole;

public record ActivitySubmission(
        String identity,
        RewardRole role,
        String contentId,
        long durationSeconds
) {
}
