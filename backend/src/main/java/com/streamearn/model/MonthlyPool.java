package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Reward budget of one calendar month.
 * {@code remainingAmount} always equals {@code totalAmount - artistSpent - listenerSpent}
 * and never drops below zero.
 */
@Getter
@Setter
@Entity
@Table(name = "monthly_pool")
public class MonthlyPool {

    @Id
    @Column(name = "period_key", nullable = false, updatable = false, length = 7)
    private String periodKey;

    @Column(name = "token_symbol", nullable = false, length = 16)
    private String tokenSymbol;

    @Column(name = "total_amount", nullable = false, precision = 30, scale = 6)
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Column(name = "remaining_amount", nullable = false, precision = 30, scale = 6)
    private BigDecimal remainingAmount = BigDecimal.ZERO;

    @Column(name = "artist_allocation", nullable = false, precision = 30, scale = 6)
    private BigDecimal artistAllocation = BigDecimal.ZERO;

    @Column(name = "listener_allocation", nullable = false, precision = 30, scale = 6)
    private BigDecimal listenerAllocation = BigDecimal.ZERO;

    @Column(name = "artist_spent", nullable = false, precision = 30, scale = 6)
    private BigDecimal artistSpent = BigDecimal.ZERO;

    @Column(name = "listener_spent", nullable = false, precision = 30, scale = 6)
    private BigDecimal listenerSpent = BigDecimal.ZERO;

    @Column(name = "halted", nullable = false)
    private boolean halted;

    @Column(name = "halt_reason", columnDefinition = "TEXT")
    private String haltReason;

    @Column(name = "halted_at")
    private OffsetDateTime haltedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public BigDecimal allocationFor(RewardRole role) {
        return role == RewardRole.ARTIST ? artistAllocation : listenerAllocation;
    }

    public BigDecimal spentFor(RewardRole role) {
        return role == RewardRole.ARTIST ? artistSpent : listenerSpent;
    }

    public void setSpentFor(RewardRole role, BigDecimal spent) {
        if (role == RewardRole.ARTIST) {
            artistSpent = spent;
        } else {
            listenerSpent = spent;
        }
    }
}
