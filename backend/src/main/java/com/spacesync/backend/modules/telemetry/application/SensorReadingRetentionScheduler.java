package com.spacesync.backend.modules.telemetry.application;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SensorReadingRetentionScheduler {

    private final SensorReadingRetentionService retentionService;

    public SensorReadingRetentionScheduler(SensorReadingRetentionService retentionService) {
        this.retentionService = retentionService;
    }

    @Scheduled(fixedDelayString = "${app.telemetry.retention-interval:PT6H}")
    public void purge() {
        retentionService.purgeExpired();
    }
}
