package com.spacesync.backend.modules.telemetry.domain;

public record JoinEvent(String devEui) {
}
