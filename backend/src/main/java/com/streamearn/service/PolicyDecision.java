package com.streamearn.service;

public record PolicyDecision(
        RejectionReason rejection,
        long approvedSeconds,
        SessionPhase phase
) {

    public static PolicyDecision approved(long approvedSeconds, SessionPhase phase) {
        return new PolicyDecision(null, approvedSeconds, phase);
    }

    public static PolicyDecision rejected(RejectionReason reason) {
        return new PolicyDecision(reason, 0L, null);
    }

    public boolean isApproved() {
        return rejection == null;
    }
}
