package com.spacesync.backend.modules.downlink.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record EnqueueDownlinkRequest(
        @NotNull UUID deviceId,
        @NotNull DownlinkCommandType command,
        Map<String, Object> payload,
        @Min(1) @Max(10) Integer priority
) {
}
