package com.streamearn.controller.dto;

import com.streamearn.model.RewardAuditEntry;
import com.streamearn.model.RewardRole;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record RewardHistoryResponse(
        String identity,
        List<Item> rewards
) {

    public static RewardHistoryResponse of(String identity, List<RewardAuditEntry> entries) {
        return new RewardHistoryResponse(identity, entries.stream().map(Item::from).toList());
    }

    public record Item(
            UUID auditId,
            String contentId,
            RewardRole role,
            BigDecimal amount,
            String tokenSymbol,
            String periodKey,
            long approvedMinutes,
            BigDecimal bonusMultiplier,
            OffsetDateTime createdAt
    ) {

        static Item from(RewardAuditEntry entry) {
            return new Item(
                    entry.getAuditId(),
                    entry.getContentId(),
                    entry.getRole(),
                    entry.getAmount(),
                    entry.getTokenSymbol(),
                    entry.getPeriodKey(),
                    entry.getApprovedSeconds() / 60,
                    entry.getBonusMultiplier(),
                    entry.getCreatedAt()
            );
        }
    }
}
