package com.spacesync.backend.modules.device.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AssignDeviceRequest(
        @NotNull UUID spaceId,
        @Size(max = 500) String reason
) {
}
