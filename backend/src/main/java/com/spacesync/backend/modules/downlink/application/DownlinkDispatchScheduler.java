package com.spacesync.backend.modules.downlink.application;

import com.spacesync.backend.modules.downlink.application.DownlinkQueueService.DispatchSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DownlinkDispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DownlinkDispatchScheduler.class);

    private final DownlinkQueueService downlinkQueueService;

    public DownlinkDispatchScheduler(DownlinkQueueService downlinkQueueService) {
        this.downlinkQueueService = downlinkQueueService;
    }

    @Scheduled(fixedDelayString = "${app.downlink.dispatch-interval:PT10S}")
    public void dispatch() {
        DispatchSummary summary = downlinkQueueService.dispatchDue();
        if (summary.total() > 0) {
            log.info("Dispatched downlinks: sent={}, retry={}, failed={}", summary.sent(), summary.retried(), summary.failed());
        }
    }
}
