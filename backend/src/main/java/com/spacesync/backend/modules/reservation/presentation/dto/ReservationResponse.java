package com.spacesync.backend.modules.reservation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.reservation.domain.Reservation;
import com.spacesync.backend.modules.reservation.domain.ReservationStatus;

public record ReservationResponse(
        UUID id,
        UUID tenantId,
        UUID spaceId,
        String requestId,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        ReservationStatus status,
        UUID requesterId,
        String requesterEmail,
        String requesterName,
        String notes,
        OffsetDateTime checkedInAt,
        OffsetDateTime cancelledAt,
        String cancellationReason,
        OffsetDateTime closedAt,
        OffsetDateTime createdAt
) {

    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getTenantId(),
                reservation.getSpaceId(),
                reservation.getRequestId(),
                reservation.getStartTime(),
                reservation.getEndTime(),
                reservation.getStatus(),
                reservation.getRequesterId(),
                reservation.getRequesterEmail(),
                reservation.getRequesterName(),
                reservation.getNotes(),
                reservation.getCheckedInAt(),
                reservation.getCancelledAt(),
                reservation.getCancellationReason(),
                reservation.getClosedAt(),
                reservation.getCreatedAt()
        );
    }
}
