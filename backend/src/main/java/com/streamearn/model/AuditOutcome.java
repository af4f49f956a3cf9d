package com.streamearn.model;

public enum AuditOutcome {
    COMMITTED
}
