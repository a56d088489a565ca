package com.spacesync.backend.modules.downlink.presentation.dto;

import java.util.UUID;

public record ClearQueueResponse(UUID deviceId, int abandoned) {
}
