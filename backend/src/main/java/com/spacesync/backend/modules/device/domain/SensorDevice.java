package com.spacesync.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import org.hibernate.annotations.DynamicUpdate;

/**
 * Occupancy sensor. {@code last_fcnt} is only advanced by the compare-and-set update in
 * {@code SensorDeviceRepository}; dynamic updates keep entity writes from overwriting it.
 */
@Entity
@DynamicUpdate
@Table(name = "sensor_device")
public class SensorDevice extends AbstractDevice {

    @Column(name = "last_fcnt")
    private Long lastFcnt;

    @Column(name = "last_rssi")
    private Integer lastRssi;

    @Column(name = "last_snr")
    private Double lastSnr;

    protected SensorDevice() {
    }

    public static SensorDevice register(UUID tenantId, String devEui, String name, OffsetDateTime now) {
        SensorDevice device = new SensorDevice();
        device.initialize(tenantId, devEui, name, now);
        return device;
    }

    @Override
    public DeviceKind getKind() {
        return DeviceKind.SENSOR;
    }

    public Long getLastFcnt() {
        return lastFcnt;
    }

    public Integer getLastRssi() {
        return lastRssi;
    }

    public Double getLastSnr() {
        return lastSnr;
    }
}
