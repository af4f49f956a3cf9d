package com.streamearn.service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of one activity submission: either a payout or a rejection, never both.
 */
public record RewardResult(
        Status status,
        BigDecimal amount,
        UUID auditId,
        RejectionReason reason
) {

    public enum Status {
        PAID,
        REJECTED
    }

    public static RewardResult paid(BigDecimal amount, UUID auditId) {
        return new RewardResult(Status.PAID, amount, auditId, null);
    }

    public static RewardResult rejected(RejectionReason reason) {
        return new RewardResult(Status.REJECTED, null, null, reason);
    }

    public boolean isPaid() {
        return status == Status.PAID;
    }
}
