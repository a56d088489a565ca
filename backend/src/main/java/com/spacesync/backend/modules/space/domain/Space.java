package com.spacesync.backend.modules.space.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;
import com.spacesync.backend.modules.tenant.domain.Site;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * A tracked physical resource. {@code currentState} is derived and only written by
 * {@link #applyDerivedState}; {@code tenantId} is only written by {@link #placeIn}.
 */
@Entity
@Table(name = "space")
public class Space extends AbstractTimestampedEntity implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "site_id", nullable = false, columnDefinition = "uuid")
    private UUID siteId;

    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "maintenance_override", nullable = false)
    private boolean maintenanceOverride;

    @Column(name = "override_reason", length = 500)
    private String overrideReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_state", nullable = false, length = 16)
    private SpaceState currentState = SpaceState.FREE;

    @Enumerated(EnumType.STRING)
    @Column(name = "sensor_state", length = 16)
    private SensorState sensorState;

    @Column(name = "sensor_state_changed_at")
    private OffsetDateTime sensorStateChangedAt;

    @Column(name = "sensor_device_id", columnDefinition = "uuid")
    private UUID sensorDeviceId;

    @Column(name = "display_device_id", columnDefinition = "uuid")
    private UUID displayDeviceId;

    @Column(name = "auto_release_minutes")
    private Integer autoReleaseMinutes;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Space() {
    }

    public static Space create(Site site, String code, String name, Integer autoReleaseMinutes, OffsetDateTime now) {
        Space space = new Space();
        space.placeIn(site);
        space.code = code;
        space.name = name;
        space.autoReleaseMinutes = autoReleaseMinutes;
        space.initializeTimestamps(now);
        return space;
    }

    /**
     * Moves the space to a site. The tenant always follows the site.
     */
    public void placeIn(Site site) {
        this.siteId = site.getId();
        this.tenantId = site.getTenantId();
    }

    /**
     * Records the sensor's latest occupancy. Returns whether the sensor state actually changed.
     */
    public boolean applySensorReading(SensorState reported, OffsetDateTime now) {
        if (reported == sensorState) {
            return false;
        }
        this.sensorState = reported;
        this.sensorStateChangedAt = now;
        touch(now);
        return true;
    }

    public void clearSensorState(OffsetDateTime now) {
        this.sensorState = null;
        this.sensorStateChangedAt = null;
        touch(now);
    }

    public void setMaintenanceOverride(boolean active, String reason, OffsetDateTime now) {
        this.maintenanceOverride = active;
        this.overrideReason = active ? reason : null;
        touch(now);
    }

    public void setEnabled(boolean enabled, OffsetDateTime now) {
        this.enabled = enabled;
        touch(now);
    }

    public void attachSensor(UUID deviceId, OffsetDateTime now) {
        this.sensorDeviceId = deviceId;
        touch(now);
    }

    public void detachSensor(OffsetDateTime now) {
        this.sensorDeviceId = null;
        clearSensorState(now);
    }

    public void attachDisplay(UUID deviceId, OffsetDateTime now) {
        this.displayDeviceId = deviceId;
        touch(now);
    }

    public void detachDisplay(OffsetDateTime now) {
        this.displayDeviceId = null;
        touch(now);
    }

    /**
     * Returns the previous state when the derived state changed, {@code null} otherwise.
     */
    public SpaceState applyDerivedState(SpaceState derived, OffsetDateTime now) {
        if (derived == currentState) {
            return null;
        }
        SpaceState previous = currentState;
        this.currentState = derived;
        touch(now);
        return previous;
    }

    public void softDelete(OffsetDateTime now) {
        this.deletedAt = now;
        touch(now);
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getSiteId() {
        return siteId;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isMaintenanceOverride() {
        return maintenanceOverride;
    }

    public String getOverrideReason() {
        return overrideReason;
    }

    public SpaceState getCurrentState() {
        return currentState;
    }

    public SensorState getSensorState() {
        return sensorState;
    }

    public OffsetDateTime getSensorStateChangedAt() {
        return sensorStateChangedAt;
    }

    public UUID getSensorDeviceId() {
        return sensorDeviceId;
    }

    public UUID getDisplayDeviceId() {
        return displayDeviceId;
    }

    public Integer getAutoReleaseMinutes() {
        return autoReleaseMinutes;
    }

    public long getVersion() {
        return version;
    }
}
