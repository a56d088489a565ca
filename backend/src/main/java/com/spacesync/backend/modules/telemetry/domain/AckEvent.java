package com.spacesync.backend.modules.telemetry.domain;

public record AckEvent(String devEui, String queueItemId, boolean acknowledged) {
}
