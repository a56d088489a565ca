package com.spacesync.backend.modules.space.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.space.domain.SensorState;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.SpaceState;

public record SpaceResponse(
        UUID id,
        UUID tenantId,
        UUID siteId,
        String code,
        String name,
        boolean enabled,
        boolean maintenanceOverride,
        String overrideReason,
        SpaceState currentState,
        SensorState sensorState,
        OffsetDateTime sensorStateChangedAt,
        UUID sensorDeviceId,
        UUID displayDeviceId,
        Integer autoReleaseMinutes,
        OffsetDateTime updatedAt
) {

    public static SpaceResponse from(Space space) {
        return new SpaceResponse(
                space.getId(),
                space.getTenantId(),
                space.getSiteId(),
                space.getCode(),
                space.getName(),
                space.isEnabled(),
                space.isMaintenanceOverride(),
                space.getOverrideReason(),
                space.getCurrentState(),
                space.getSensorState(),
                space.getSensorStateChangedAt(),
                space.getSensorDeviceId(),
                space.getDisplayDeviceId(),
                space.getAutoReleaseMinutes(),
                space.getUpdatedAt()
        );
    }
}
