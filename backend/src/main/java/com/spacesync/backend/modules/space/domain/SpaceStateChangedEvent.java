package com.spacesync.backend.modules.space.domain;

import java.util.UUID;

/**
 * Published inside the recompute transaction; listeners observe it after commit.
 */
public record SpaceStateChangedEvent(
        UUID tenantId,
        UUID spaceId,
        UUID displayDeviceId,
        SpaceState previousState,
        SpaceState newState,
        StateChangeSource source
) {
}
