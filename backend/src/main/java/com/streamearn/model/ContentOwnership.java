package com.streamearn.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Owner of a piece of content, as published by the content-metadata service.
 */
@Getter
@Setter
@Entity
@Table(name = "content_ownership")
public class ContentOwnership {

    @Id
    @Column(name = "content_id", nullable = false, updatable = false, length = 128)
    private String contentId;

    @Column(name = "owner_identity", nullable = false, length = 128)
    private String ownerIdentity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
