package com.spacesync.backend.modules.space.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AutoReleaseScheduler {

    private static final Logger log = LoggerFactory.getLogger(AutoReleaseScheduler.class);

    private final SpaceStateService spaceStateService;

    public AutoReleaseScheduler(SpaceStateService spaceStateService) {
        this.spaceStateService = spaceStateService;
    }

    @Scheduled(fixedDelayString = "${app.space.auto-release-interval:PT1M}")
    public void releaseStaleOccupancy() {
        int released = spaceStateService.releaseStaleOccupancy();
        if (released > 0) {
            log.info("Released {} spaces with stale occupancy", released);
        }
    }
}
