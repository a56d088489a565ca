package com.spacesync.backend.modules.downlink.application;

import com.spacesync.backend.modules.device.domain.DisplayAssignedEvent;
import com.spacesync.backend.modules.space.domain.SpaceStateChangedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes the colour of a space to its display once a state change has committed. Failures are
 * logged and dropped: the display catches up on the next transition.
 */
@Component
public class DisplayStateSync {

    private static final Logger log = LoggerFactory.getLogger(DisplayStateSync.class);

    private final DownlinkQueueService downlinkQueueService;

    public DisplayStateSync(DownlinkQueueService downlinkQueueService) {
        this.downlinkQueueService = downlinkQueueService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStateChanged(SpaceStateChangedEvent event) {
        if (event.displayDeviceId() == null) {
            return;
        }
        try {
            downlinkQueueService.enqueueDisplayState(event.tenantId(), event.displayDeviceId(), event.newState());
        } catch (RuntimeException ex) {
            log.warn("Display update for space {} ({}) not queued: {}", event.spaceId(), event.newState(), ex.getMessage());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onDisplayAssigned(DisplayAssignedEvent event) {
        try {
            downlinkQueueService.enqueueDisplayState(event.tenantId(), event.displayDeviceId(), event.currentState());
        } catch (RuntimeException ex) {
            log.warn("Initial display update for space {} not queued: {}", event.spaceId(), ex.getMessage());
        }
    }
}
