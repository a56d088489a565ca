package com.spacesync.backend.modules.tenant.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Isolation boundary. Tenants are deactivated on suspension and never deleted.
 */
@Entity
@Table(name = "tenant")
public class Tenant extends AbstractTimestampedEntity implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "slug", nullable = false, unique = true, length = 100)
    private String slug;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 32)
    private SubscriptionTier subscriptionTier = SubscriptionTier.BASIC;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    protected Tenant() {
    }

    public static Tenant register(String name, String slug, SubscriptionTier tier, OffsetDateTime now) {
        Tenant tenant = new Tenant();
        tenant.name = name;
        tenant.slug = slug;
        tenant.subscriptionTier = tier;
        tenant.initializeTimestamps(now);
        return tenant;
    }

    public void deactivate(OffsetDateTime now) {
        if (!active) {
            return;
        }
        this.active = false;
        this.deactivatedAt = now;
        touch(now);
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSlug() {
        return slug;
    }

    public boolean isActive() {
        return active;
    }

    public SubscriptionTier getSubscriptionTier() {
        return subscriptionTier;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }
}
