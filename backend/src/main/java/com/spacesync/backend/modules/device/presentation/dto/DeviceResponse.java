package com.spacesync.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.DeviceKind;
import com.spacesync.backend.modules.device.domain.DeviceLifecycleState;
import com.spacesync.backend.modules.device.domain.SensorDevice;

public record DeviceResponse(
        UUID id,
        UUID tenantId,
        DeviceKind kind,
        String devEui,
        String name,
        DeviceLifecycleState lifecycleState,
        UUID assignedSpaceId,
        OffsetDateTime lastSeenAt,
        Long lastFcnt,
        Integer lastRssi,
        Double lastSnr
) {

    public static DeviceResponse from(AbstractDevice device) {
        Long lastFcnt = null;
        Integer lastRssi = null;
        Double lastSnr = null;
        if (device instanceof SensorDevice sensor) {
            lastFcnt = sensor.getLastFcnt();
            lastRssi = sensor.getLastRssi();
            lastSnr = sensor.getLastSnr();
        }
        return new DeviceResponse(
                device.getId(),
                device.getTenantId(),
                device.getKind(),
                device.getDevEui(),
                device.getName(),
                device.getLifecycleState(),
                device.getAssignedSpaceId(),
                device.getLastSeenAt(),
                lastFcnt,
                lastRssi,
                lastSnr
        );
    }
}
