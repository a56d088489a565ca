package com.spacesync.backend.modules.space.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SpaceEnablementRequest(
        @NotNull Boolean enabled,
        @NotBlank @Size(max = 500) String reason
) {
}
