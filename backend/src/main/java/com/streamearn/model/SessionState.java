package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Continuous-session bookkeeping of one identity. Accrual is kept in seconds.
 */
@Getter
@Setter
@Entity
@Table(name = "session_state")
public class SessionState {

    @Id
    @Column(name = "identity", nullable = false, updatable = false, length = 128)
    private String identity;

    @Column(name = "session_started_at")
    private OffsetDateTime sessionStartedAt;

    @Column(name = "continuous_seconds", nullable = false)
    private long continuousSeconds;

    @Column(name = "last_activity_at")
    private OffsetDateTime lastActivityAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
