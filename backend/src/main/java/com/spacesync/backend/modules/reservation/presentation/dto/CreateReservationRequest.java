package com.spacesync.backend.modules.reservation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateReservationRequest(
        @NotNull UUID spaceId,
        @NotNull OffsetDateTime startTime,
        @NotNull OffsetDateTime endTime,
        @NotBlank @Size(max = 128) String requestId,
        @Email @Size(max = 320) String requesterEmail,
        @Size(max = 200) String requesterName,
        @Size(max = 1000) String notes
) {
}
