package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only record of a committed reward. Rows are never updated or deleted;
 * they are the canonical source for reconciliation against the pool ledger.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Immutable
@Table(name = "reward_audit_log")
public class RewardAuditEntry {

    @Id
    @Column(name = "audit_id", nullable = false, updatable = false)
    private UUID auditId;

    @Column(name = "identity", nullable = false, updatable = false, length = 128)
    private String identity;

    @Column(name = "content_id", nullable = false, updatable = false, length = 128)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private RewardRole role;

    @Column(name = "amount", nullable = false, updatable = false, precision = 30, scale = 6)
    private BigDecimal amount;

    @Column(name = "token_symbol", nullable = false, updatable = false, length = 16)
    private String tokenSymbol;

    @Column(name = "period_key", nullable = false, updatable = false, length = 7)
    private String periodKey;

    @Column(name = "approved_seconds", nullable = false, updatable = false)
    private long approvedSeconds;

    @Column(name = "bonus_multiplier", nullable = false, updatable = false, precision = 12, scale = 6)
    private BigDecimal bonusMultiplier;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, updatable = false, length = 16)
    private AuditOutcome outcome;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public RewardAuditEntry(
            UUID auditId,
            String identity,
            String contentId,
            RewardRole role,
            BigDecimal amount,
            String tokenSymbol,
            String periodKey,
            long approvedSeconds,
            BigDecimal bonusMultiplier,
            AuditOutcome outcome,
            OffsetDateTime createdAt
    ) {
        this.auditId = auditId;
        this.identity = identity;
        this.contentId = contentId;
        this.role = role;
        this.amount = amount;
        this.tokenSymbol = tokenSymbol;
        this.periodKey = periodKey;
        this.approvedSeconds = approvedSeconds;
        this.bonusMultiplier = bonusMultiplier;
        this.outcome = outcome;
        this.createdAt = createdAt;
    }
}
