package com.spacesync.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only assignment history.
 */
@Entity
@Immutable
@Table(name = "device_assignment")
public class DeviceAssignment implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "device_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_kind", nullable = false, updatable = false, length = 16)
    private DeviceKind deviceKind;

    @Column(name = "space_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID spaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 16)
    private AssignmentAction action;

    @Column(name = "actor_id", updatable = false, columnDefinition = "uuid")
    private UUID actorId;

    @Column(name = "reason", updatable = false, length = 500)
    private String reason;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    protected DeviceAssignment() {
    }

    public static DeviceAssignment record(AbstractDevice device, UUID spaceId, AssignmentAction action,
                                          UUID actorId, String reason, OffsetDateTime now) {
        DeviceAssignment assignment = new DeviceAssignment();
        assignment.tenantId = device.getTenantId();
        assignment.deviceId = device.getId();
        assignment.deviceKind = device.getKind();
        assignment.spaceId = spaceId;
        assignment.action = action;
        assignment.actorId = actorId;
        assignment.reason = reason;
        assignment.occurredAt = now;
        return assignment;
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getDeviceId() {
        return deviceId;
    }

    public DeviceKind getDeviceKind() {
        return deviceKind;
    }

    public UUID getSpaceId() {
        return spaceId;
    }

    public AssignmentAction getAction() {
        return action;
    }

    public UUID getActorId() {
        return actorId;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }
}
