package com.spacesync.backend.modules.telemetry.infrastructure.spool;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports {@code webhookSpool}: DOWN once the backlog reaches its bound and deliveries are being refused.
 */
@Component("webhookSpool")
public class WebhookSpoolHealthIndicator implements HealthIndicator {

    private final WebhookSpool spool;

    public WebhookSpoolHealthIndicator(WebhookSpool spool) {
        this.spool = spool;
    }

    @Override
    public Health health() {
        long backlog = spool.backlogBytes();
        Health.Builder builder = backlog >= spool.getMaxBacklogBytes() ? Health.down() : Health.up();
        return builder
                .withDetail("backlogBytes", backlog)
                .withDetail("maxBacklogBytes", spool.getMaxBacklogBytes())
                .build();
    }
}
