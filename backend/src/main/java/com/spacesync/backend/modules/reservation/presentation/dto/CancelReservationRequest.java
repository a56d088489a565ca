package com.spacesync.backend.modules.reservation.presentation.dto;

import jakarta.validation.constraints.Size;

public record CancelReservationRequest(@Size(max = 500) String reason) {
}
