package com.spacesync.backend.modules.device.presentation.dto;

import java.util.List;

public record OrphanDeviceListResponse(List<OrphanDeviceResponse> items, int page, int size, long totalElements) {
}
