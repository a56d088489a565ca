package com.spacesync.backend.modules.reservation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record AvailabilityResponse(
        UUID spaceId,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        boolean available,
        List<ReservationResponse> conflicts
) {
}
