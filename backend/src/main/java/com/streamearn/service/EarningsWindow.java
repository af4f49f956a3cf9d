package com.streamearn.service;

import java.util.Locale;

/**
 * Look-back window for leaderboards, counted in whole days ending today.
 */
public enum EarningsWindow {
    TODAY(0),
    WEEK(7),
    MONTH(30);

    private final int daysBack;

    EarningsWindow(int daysBack) {
        this.daysBack = daysBack;
    }

    public int daysBack() {
        return daysBack;
    }

    public static EarningsWindow parse(String value) {
        if (value == null || value.isBlank()) {
            return TODAY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown period: " + value + " (expected today, week or month)");
        }
    }
}
