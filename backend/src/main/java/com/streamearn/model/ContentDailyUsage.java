package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "content_daily_usage")
@IdClass(ContentDailyUsageId.class)
public class ContentDailyUsage {

    @Id
    @Column(name = "identity", nullable = false, updatable = false, length = 128)
    private String identity;

    @Id
    @Column(name = "content_id", nullable = false, updatable = false, length = 128)
    private String contentId;

    @Id
    @Column(name = "usage_date", nullable = false, updatable = false)
    private LocalDate usageDate;

    @Column(name = "seconds_accrued", nullable = false)
    private long secondsAccrued;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
