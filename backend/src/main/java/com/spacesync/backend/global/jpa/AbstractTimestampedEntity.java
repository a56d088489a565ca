package com.spacesync.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * created_at / updated_at columns shared by the mutable entities.
 * Stamping happens in the owning entity's mutators, with the time supplied by the caller's clock.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected void initializeTimestamps(OffsetDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    protected void touch(OffsetDateTime now) {
        this.updatedAt = now;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
