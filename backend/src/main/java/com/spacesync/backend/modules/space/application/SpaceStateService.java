package com.spacesync.backend.modules.space.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.jpa.OptimisticRetryExecutor;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.global.web.RequestIdFilter;
import com.spacesync.backend.modules.space.domain.ActiveReservationLookup;
import com.spacesync.backend.modules.space.domain.SensorState;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.SpaceState;
import com.spacesync.backend.modules.space.domain.SpaceStateChangedEvent;
import com.spacesync.backend.modules.space.domain.SpaceStateResolver;
import com.spacesync.backend.modules.space.domain.StateChange;
import com.spacesync.backend.modules.space.domain.StateChangeSource;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;
import com.spacesync.backend.modules.space.infrastructure.persistence.StateChangeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the write path of {@code space.current_state}.
 *
 * <p>A recompute is a read-modify-write of the space row guarded by its version column. Callers that
 * already hold a transaction (uplink processing, device assignment) use {@link #recomputeWithin};
 * everything else goes through {@link #recompute} or {@link #mutate}, which run in their own
 * transaction and replay on an optimistic conflict. A transition appends exactly one
 * {@link StateChange} and publishes a {@link SpaceStateChangedEvent}; an unchanged result writes nothing.
 */
@Service
public class SpaceStateService {

    private static final Logger log = LoggerFactory.getLogger(SpaceStateService.class);

    private final SpaceRepository spaceRepository;
    private final StateChangeRepository stateChangeRepository;
    private final ActiveReservationLookup activeReservationLookup;
    private final OptimisticRetryExecutor retryExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SpaceStateService(
            SpaceRepository spaceRepository,
            StateChangeRepository stateChangeRepository,
            ActiveReservationLookup activeReservationLookup,
            OptimisticRetryExecutor retryExecutor,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.spaceRepository = spaceRepository;
        this.stateChangeRepository = stateChangeRepository;
        this.activeReservationLookup = activeReservationLookup;
        this.retryExecutor = retryExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public SpaceState recompute(TenantContext context, UUID spaceId, StateChangeSource source, String requestId) {
        return mutate(context, spaceId, source, requestId, space -> {
        });
    }

    /**
     * Applies {@code mutation} to the space and recomputes, all in one transaction that is replayed
     * on a version conflict. The mutation may therefore run more than once.
     */
    public SpaceState mutate(TenantContext context, UUID spaceId, StateChangeSource source, String requestId,
                             Consumer<Space> mutation) {
        String correlation = requestId != null ? requestId : RequestIdFilter.currentRequestId();
        return retryExecutor.execute("space " + spaceId + " recompute", () -> {
            Space space = spaceRepository.findById(spaceId, context)
                    .orElseThrow(() -> ProblemException.notFound("space.not_found", "Space not found: " + spaceId));
            mutation.accept(space);
            return applyRecompute(context, space, source, correlation);
        });
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public SpaceState recomputeWithin(TenantContext context, Space space, StateChangeSource source, String requestId) {
        context.requireAccess(space, "space");
        String correlation = requestId != null ? requestId : RequestIdFilter.currentRequestId();
        return applyRecompute(context, space, source, correlation);
    }

    /**
     * Clears stale occupied readings on spaces whose auto-release window elapsed with no active
     * booking. Returns the number of spaces released.
     */
    public int releaseStaleOccupancy() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TenantContext platform = TenantContext.platform();
        List<UUID> candidates = spaceRepository.findAutoReleaseCandidates(now, platform);
        int released = 0;
        for (UUID spaceId : candidates) {
            AtomicBoolean cleared = new AtomicBoolean();
            try {
                mutate(platform, spaceId, StateChangeSource.AUTO_RELEASE, null, space -> {
                    cleared.set(false);
                    if (isStillStale(platform, space, now)) {
                        space.applySensorReading(SensorState.FREE, now);
                        cleared.set(true);
                    }
                });
            } catch (ProblemException ex) {
                log.debug("Skipped auto-release of space {}: {}", spaceId, ex.getCode());
                continue;
            }
            if (cleared.get()) {
                released++;
            }
        }
        return released;
    }

    private boolean isStillStale(TenantContext context, Space space, OffsetDateTime now) {
        if (space.getSensorState() != SensorState.OCCUPIED
                || space.getAutoReleaseMinutes() == null
                || space.getSensorStateChangedAt() == null) {
            return false;
        }
        OffsetDateTime releaseAt = space.getSensorStateChangedAt().plusMinutes(space.getAutoReleaseMinutes());
        return !releaseAt.isAfter(now) && !activeReservationLookup.hasReservationActiveAt(context, space.getId(), now);
    }

    private SpaceState applyRecompute(TenantContext context, Space space, StateChangeSource source,
                                      String requestId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean reservedNow = activeReservationLookup.hasReservationActiveAt(context, space.getId(), now);
        SpaceState derived = SpaceStateResolver.resolve(space, reservedNow);
        SpaceState previous = space.applyDerivedState(derived, now);
        if (previous == null) {
            return derived;
        }

        spaceRepository.saveAndFlush(space);
        stateChangeRepository.save(StateChange.record(space, previous, source, requestId, now));
        eventPublisher.publishEvent(new SpaceStateChangedEvent(
                space.getTenantId(),
                space.getId(),
                space.getDisplayDeviceId(),
                previous,
                derived,
                source
        ));
        log.info("Space {} {} -> {} ({})", space.getId(), previous, derived, source);
        return derived;
    }
}
