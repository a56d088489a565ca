package com.spacesync.backend.modules.telemetry.domain;

import java.util.Locale;

/**
 * Integration events the network server posts to the webhook, selected by the {@code event} query parameter.
 */
public enum WebhookEventType {
    UP,
    JOIN,
    ACK;

    public static WebhookEventType parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("event is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported event: " + raw, ex);
        }
    }
}
