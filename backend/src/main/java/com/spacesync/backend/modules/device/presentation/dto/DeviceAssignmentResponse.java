package com.spacesync.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.device.domain.AssignmentAction;
import com.spacesync.backend.modules.device.domain.DeviceAssignment;
import com.spacesync.backend.modules.device.domain.DeviceKind;

public record DeviceAssignmentResponse(
        UUID id,
        UUID deviceId,
        DeviceKind deviceKind,
        UUID spaceId,
        AssignmentAction action,
        UUID actorId,
        String reason,
        OffsetDateTime occurredAt
) {

    public static DeviceAssignmentResponse from(DeviceAssignment assignment) {
        return new DeviceAssignmentResponse(
                assignment.getId(),
                assignment.getDeviceId(),
                assignment.getDeviceKind(),
                assignment.getSpaceId(),
                assignment.getAction(),
                assignment.getActorId(),
                assignment.getReason(),
                assignment.getOccurredAt()
        );
    }
}
