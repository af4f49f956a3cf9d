package com.streamearn.service;

import java.time.OffsetDateTime;

/**
 * Per-identity state read once at the start of a request. Every policy check of
 * that request is evaluated against the same snapshot.
 */
public record ActivitySnapshot(
        OffsetDateTime lastActivityAt,
        long continuousSeconds,
        long contentSecondsToday
) {

    public static ActivitySnapshot empty() {
        return new ActivitySnapshot(null, 0L, 0L);
    }
}
