package com.spacesync.backend.modules.reservation.presentation.dto;

import java.util.List;

public record ReservationListResponse(List<ReservationResponse> items, int page, int size, long totalElements) {
}
