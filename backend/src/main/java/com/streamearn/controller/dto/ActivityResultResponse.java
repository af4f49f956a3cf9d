package com.streamearn.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.streamearn.service.RejectionReason;
import com.streamearn.service.RewardResult;

import java.math.BigDecimal;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityResultResponse(
        String status,
        BigDecimal amount,
        String tokenSymbol,
        UUID auditId,
        RejectionReason reason,
        String category,
        String message,
        Boolean retryable,
        Long retryAfterSeconds
) {

    public static ActivityResultResponse from(RewardResult result, String tokenSymbol) {
        if (result.isPaid()) {
            return new ActivityResultResponse(
                    result.status().name(),
                    result.amount(),
                    tokenSymbol,
                    result.auditId(),
                    null,
                    null,
                    null,
                    null,
                    null
            );
        }
        return rejected(result.reason(), null);
    }

    public static ActivityResultResponse throttled(long retryAfterSeconds) {
        return rejected(RejectionReason.THROTTLED, retryAfterSeconds);
    }

    private static ActivityResultResponse rejected(RejectionReason reason, Long retryAfterSeconds) {
        return new ActivityResultResponse(
                RewardResult.Status.REJECTED.name(),
                null,
                null,
                null,
                reason,
                reason.category().name(),
                reason.userMessage(),
                reason.retryable(),
                retryAfterSeconds
        );
    }
}
