package com.spacesync.backend.modules.space.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.space.domain.SpaceState;
import com.spacesync.backend.modules.space.domain.StateChange;
import com.spacesync.backend.modules.space.domain.StateChangeSource;

public record StateChangeResponse(
        Long id,
        UUID spaceId,
        SpaceState previousState,
        SpaceState newState,
        StateChangeSource source,
        String requestId,
        OffsetDateTime changedAt
) {

    public static StateChangeResponse from(StateChange change) {
        return new StateChangeResponse(
                change.getId(),
                change.getSpaceId(),
                change.getPreviousState(),
                change.getNewState(),
                change.getSource(),
                change.getRequestId(),
                change.getChangedAt()
        );
    }
}
