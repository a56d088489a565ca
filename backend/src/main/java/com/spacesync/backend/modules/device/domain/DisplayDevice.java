package com.spacesync.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import org.hibernate.annotations.DynamicUpdate;

@Entity
@DynamicUpdate
@Table(name = "display_device")
public class DisplayDevice extends AbstractDevice {

    protected DisplayDevice() {
    }

    public static DisplayDevice register(UUID tenantId, String devEui, String name, OffsetDateTime now) {
        DisplayDevice device = new DisplayDevice();
        device.initialize(tenantId, devEui, name, now);
        return device;
    }

    @Override
    public DeviceKind getKind() {
        return DeviceKind.DISPLAY;
    }
}
