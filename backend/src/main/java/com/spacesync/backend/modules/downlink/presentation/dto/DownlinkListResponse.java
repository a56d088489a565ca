package com.spacesync.backend.modules.downlink.presentation.dto;

import java.util.List;

public record DownlinkListResponse(List<DownlinkCommandResponse> items, int page, int size, long totalElements) {
}
