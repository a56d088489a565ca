package com.spacesync.backend.modules.telemetry.infrastructure.spool;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.modules.telemetry.domain.WebhookEventType;

/**
 * A verified delivery waiting for storage to come back. The body is kept raw so replay runs the
 * same parsing and processing as a live request.
 */
public record SpooledEvent(WebhookEventType event, UUID tenantHint, byte[] body, OffsetDateTime receivedAt) {
}
