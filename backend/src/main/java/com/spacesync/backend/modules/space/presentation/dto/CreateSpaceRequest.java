package com.spacesync.backend.modules.space.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateSpaceRequest(
        @NotNull UUID siteId,
        @NotBlank @Size(max = 64) String code,
        @Size(max = 200) String name,
        @Positive Integer autoReleaseMinutes
) {
}
