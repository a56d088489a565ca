package com.spacesync.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * Columns shared by sensors and displays. A device belongs to one tenant and at most one space.
 */
@MappedSuperclass
public abstract class AbstractDevice extends AbstractTimestampedEntity implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "dev_eui", nullable = false, updatable = false, length = 16)
    private String devEui;

    @Column(name = "name", length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle_state", nullable = false, length = 16)
    private DeviceLifecycleState lifecycleState = DeviceLifecycleState.PROVISIONED;

    @Column(name = "assigned_space_id", columnDefinition = "uuid")
    private UUID assignedSpaceId;

    @Column(name = "last_seen_at")
    private OffsetDateTime lastSeenAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected void initialize(UUID tenantId, String devEui, String name, OffsetDateTime now) {
        this.tenantId = tenantId;
        this.devEui = DevEui.normalize(devEui);
        this.name = name;
        initializeTimestamps(now);
    }

    public abstract DeviceKind getKind();

    public void assignTo(UUID spaceId, OffsetDateTime now) {
        this.assignedSpaceId = spaceId;
        this.lifecycleState = DeviceLifecycleState.OPERATIONAL;
        touch(now);
    }

    public void unassign(OffsetDateTime now) {
        this.assignedSpaceId = null;
        touch(now);
    }

    public boolean isAssigned() {
        return assignedSpaceId != null;
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public String getDevEui() {
        return devEui;
    }

    public String getName() {
        return name;
    }

    public DeviceLifecycleState getLifecycleState() {
        return lifecycleState;
    }

    public UUID getAssignedSpaceId() {
        return assignedSpaceId;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public long getVersion() {
        return version;
    }
}
