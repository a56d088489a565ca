package com.spacesync.backend.modules.downlink.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;
import com.spacesync.backend.modules.downlink.domain.DownlinkStatus;

public record DownlinkCommandResponse(
        Long id,
        UUID deviceId,
        String devEui,
        UUID spaceId,
        DownlinkCommandType command,
        Map<String, Object> payload,
        int priority,
        DownlinkStatus status,
        int attempts,
        OffsetDateTime nextAttemptAt,
        String lastError,
        String networkQueueId,
        OffsetDateTime createdAt,
        OffsetDateTime sentAt,
        OffsetDateTime deliveredAt,
        OffsetDateTime closedAt
) {

    public static DownlinkCommandResponse from(DownlinkCommand command) {
        return new DownlinkCommandResponse(
                command.getId(),
                command.getDeviceId(),
                command.getDevEui(),
                command.getSpaceId(),
                command.getCommandType(),
                command.getPayload(),
                command.getPriority(),
                command.getStatus(),
                command.getAttempts(),
                command.getNextAttemptAt(),
                command.getLastError(),
                command.getNetworkQueueId(),
                command.getCreatedAt(),
                command.getSentAt(),
                command.getDeliveredAt(),
                command.getClosedAt()
        );
    }
}
