package com.spacesync.backend.modules.reservation.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReservationSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReservationSweepScheduler.class);

    private final ReservationService reservationService;

    public ReservationSweepScheduler(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @Scheduled(fixedDelayString = "${app.reservation.sweep-interval:PT1M}")
    public void sweep() {
        int closed = reservationService.expireOverdue();
        if (closed > 0) {
            log.info("Closed {} overdue reservations", closed);
        }
        int activated = reservationService.activateStartedWindows();
        if (activated > 0) {
            log.info("Marked {} spaces reserved at window start", activated);
        }
    }
}
