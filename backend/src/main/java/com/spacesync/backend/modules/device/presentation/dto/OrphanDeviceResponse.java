package com.spacesync.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;

import com.spacesync.backend.modules.device.domain.OrphanDevice;

public record OrphanDeviceResponse(
        String devEui,
        OffsetDateTime firstSeenAt,
        OffsetDateTime lastSeenAt,
        long messageCount,
        String lastEvent,
        String lastPayload
) {

    public static OrphanDeviceResponse from(OrphanDevice orphan) {
        return new OrphanDeviceResponse(
                orphan.getDevEui(),
                orphan.getFirstSeenAt(),
                orphan.getLastSeenAt(),
                orphan.getMessageCount(),
                orphan.getLastEvent(),
                orphan.getLastPayload()
        );
    }
}
