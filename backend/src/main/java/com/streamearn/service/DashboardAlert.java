package com.streamearn.service;

public record DashboardAlert(
        Type type,
        String message
) {

    public enum Type {
        LOW_POOL_BALANCE,
        HIGH_DAILY_EMISSION,
        ANOMALY_DETECTED,
        POOL_HALTED
    }
}
