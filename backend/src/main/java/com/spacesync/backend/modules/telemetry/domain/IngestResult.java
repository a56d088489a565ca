package com.spacesync.backend.modules.telemetry.domain;

public record IngestResult(IngestOutcome outcome, String devEui, Long fcnt) {

    public static IngestResult of(IngestOutcome outcome, String devEui) {
        return new IngestResult(outcome, devEui, null);
    }
}
