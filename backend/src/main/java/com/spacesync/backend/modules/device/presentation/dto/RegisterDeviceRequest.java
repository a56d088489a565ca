package com.spacesync.backend.modules.device.presentation.dto;

import com.spacesync.backend.modules.device.domain.DeviceKind;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterDeviceRequest(
        @NotNull DeviceKind kind,
        @NotBlank @Size(max = 32) String devEui,
        @Size(max = 200) String name
) {
}
