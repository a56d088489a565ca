package com.spacesync.backend.modules.space.presentation.dto;

import java.util.List;

public record StateChangeListResponse(
        List<StateChangeResponse> items,
        int page,
        int size,
        long totalElements
) {
}
