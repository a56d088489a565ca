package com.spacesync.backend.modules.telemetry.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class WebhookSpoolReplayScheduler {

    private static final Logger log = LoggerFactory.getLogger(WebhookSpoolReplayScheduler.class);

    private final WebhookIngestionService ingestionService;

    public WebhookSpoolReplayScheduler(WebhookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Scheduled(fixedDelayString = "${app.webhook.spool.replay-interval:PT1M}")
    public void replay() {
        int replayed = ingestionService.replaySpool();
        if (replayed > 0) {
            log.info("Replayed {} spooled webhook deliveries", replayed);
        }
    }
}
