package com.spacesync.backend.modules.telemetry.presentation.dto;

import com.spacesync.backend.modules.telemetry.domain.IngestOutcome;
import com.spacesync.backend.modules.telemetry.domain.IngestResult;

public record WebhookAck(IngestOutcome outcome, String devEui, Long fcnt) {

    public static WebhookAck from(IngestResult result) {
        return new WebhookAck(result.outcome(), result.devEui(), result.fcnt());
    }
}
