package com.spacesync.backend.modules.telemetry.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * One accepted telemetry frame. Only frames that won the frame-counter compare-and-set are stored.
 */
@Entity
@Immutable
@Table(name = "sensor_reading")
public class SensorReading implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "device_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID deviceId;

    @Column(name = "space_id", updatable = false, columnDefinition = "uuid")
    private UUID spaceId;

    @Column(name = "fcnt", nullable = false, updatable = false)
    private long fcnt;

    @Column(name = "occupied", updatable = false)
    private Boolean occupied;

    @Column(name = "rssi", updatable = false)
    private Integer rssi;

    @Column(name = "snr", updatable = false)
    private Double snr;

    @Column(name = "received_at", nullable = false, updatable = false)
    private OffsetDateTime receivedAt;

    protected SensorReading() {
    }

    public static SensorReading accepted(UUID tenantId, UUID deviceId, UUID spaceId, UplinkEvent uplink,
                                         OffsetDateTime receivedAt) {
        SensorReading reading = new SensorReading();
        reading.tenantId = tenantId;
        reading.deviceId = deviceId;
        reading.spaceId = spaceId;
        reading.fcnt = uplink.fcnt();
        reading.occupied = uplink.occupied();
        reading.rssi = uplink.rssi();
        reading.snr = uplink.snr();
        reading.receivedAt = receivedAt;
        return reading;
    }

    public Long getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getDeviceId() {
        return deviceId;
    }

    public UUID getSpaceId() {
        return spaceId;
    }

    public long getFcnt() {
        return fcnt;
    }

    public Boolean getOccupied() {
        return occupied;
    }

    public Integer getRssi() {
        return rssi;
    }

    public Double getSnr() {
        return snr;
    }

    public OffsetDateTime getReceivedAt() {
        return receivedAt;
    }
}
