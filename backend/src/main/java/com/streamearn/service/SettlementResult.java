package com.streamearn.service;

import java.util.UUID;

public record SettlementResult(
        UUID auditId,
        RejectionReason failure
) {

    public static SettlementResult committed(UUID auditId) {
        return new SettlementResult(auditId, null);
    }

    public static SettlementResult failed(RejectionReason failure) {
        return new SettlementResult(null, failure);
    }

    public boolean isCommitted() {
        return failure == null;
    }
}
