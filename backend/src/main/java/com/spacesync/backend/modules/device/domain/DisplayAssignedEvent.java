package com.spacesync.backend.modules.device.domain;

import java.util.UUID;

import com.spacesync.backend.modules.space.domain.SpaceState;

public record DisplayAssignedEvent(UUID tenantId, UUID spaceId, UUID displayDeviceId, SpaceState currentState) {
}
