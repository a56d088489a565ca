package com.spacesync.backend.modules.space.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.space.domain.ActiveReservationLookup;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.StateChange;
import com.spacesync.backend.modules.space.domain.StateChangeSource;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;
import com.spacesync.backend.modules.space.infrastructure.persistence.StateChangeRepository;
import com.spacesync.backend.modules.tenant.domain.Site;
import com.spacesync.backend.modules.tenant.infrastructure.persistence.SiteRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class SpaceService {

    private static final Logger log = LoggerFactory.getLogger(SpaceService.class);
    private static final int MAX_REASON_LENGTH = 500;

    private final SpaceRepository spaceRepository;
    private final SiteRepository siteRepository;
    private final StateChangeRepository stateChangeRepository;
    private final SpaceStateService spaceStateService;
    private final ActiveReservationLookup activeReservationLookup;
    private final Clock clock;

    public SpaceService(
            SpaceRepository spaceRepository,
            SiteRepository siteRepository,
            StateChangeRepository stateChangeRepository,
            SpaceStateService spaceStateService,
            ActiveReservationLookup activeReservationLookup,
            Clock clock
    ) {
        this.spaceRepository = spaceRepository;
        this.siteRepository = siteRepository;
        this.stateChangeRepository = stateChangeRepository;
        this.spaceStateService = spaceStateService;
        this.activeReservationLookup = activeReservationLookup;
        this.clock = clock;
    }

    @Transactional
    public Space createSpace(TenantContext context, CreateSpaceCommand command) {
        Site site = siteRepository.findById(command.siteId(), context)
                .orElseThrow(() -> ProblemException.notFound("site.not_found", "Site not found: " + command.siteId()));
        if (command.autoReleaseMinutes() != null && command.autoReleaseMinutes() < 1) {
            throw ProblemException.validation("space.invalid_auto_release", "autoReleaseMinutes must be positive");
        }
        if (spaceRepository.existsByCode(site.getTenantId(), site.getId(), command.code())) {
            throw ProblemException.conflict("space.code_taken", "Space code already used on this site: " + command.code());
        }
        Space space = Space.create(site, command.code(), command.name(), command.autoReleaseMinutes(),
                OffsetDateTime.now(clock));
        return spaceRepository.saveAndFlush(space);
    }

    @Transactional(readOnly = true)
    public Space getSpace(TenantContext context, UUID spaceId) {
        return spaceRepository.findById(spaceId, context)
                .orElseThrow(() -> ProblemException.notFound("space.not_found", "Space not found: " + spaceId));
    }

    @Transactional(readOnly = true)
    public List<Space> listSpaces(TenantContext context, UUID siteId) {
        return spaceRepository.findAll(siteId, context);
    }

    public Space setMaintenanceOverride(TenantContext context, UUID spaceId, boolean active, String reason) {
        String normalizedReason = requireReason(reason);
        spaceStateService.mutate(context, spaceId, StateChangeSource.MANUAL_OVERRIDE, null,
                space -> space.setMaintenanceOverride(active, normalizedReason, OffsetDateTime.now(clock)));
        log.info("Maintenance override {} on space {} by {}: {}",
                active ? "set" : "cleared", spaceId, context.actorId(), normalizedReason);
        return getSpace(context, spaceId);
    }

    public Space setEnabled(TenantContext context, UUID spaceId, boolean enabled, String reason) {
        String normalizedReason = requireReason(reason);
        spaceStateService.mutate(context, spaceId, StateChangeSource.ENABLEMENT, null,
                space -> space.setEnabled(enabled, OffsetDateTime.now(clock)));
        log.info("Space {} {} by {}: {}", spaceId, enabled ? "enabled" : "disabled", context.actorId(), normalizedReason);
        return getSpace(context, spaceId);
    }

    /**
     * Tombstones the space. Refused while devices are assigned to it or bookings on it are still
     * active; history rows keep pointing at the tombstone.
     */
    @Transactional
    public void deleteSpace(TenantContext context, UUID spaceId) {
        Space space = getSpace(context, spaceId);
        if (space.getSensorDeviceId() != null || space.getDisplayDeviceId() != null) {
            throw ProblemException.conflict("space.devices_assigned",
                    "Unassign the devices of space " + space.getCode() + " before deleting it");
        }
        long activeReservations = activeReservationLookup.countActiveReservations(context, spaceId);
        if (activeReservations > 0) {
            throw ProblemException.conflict("space.active_reservations",
                    "Space " + space.getCode() + " still has " + activeReservations + " active reservations")
                    .with("activeReservations", activeReservations);
        }
        space.softDelete(OffsetDateTime.now(clock));
        spaceRepository.saveAndFlush(space);
        log.info("Space {} ({}) deleted by {}", spaceId, space.getCode(), context.actorId());
    }

    @Transactional(readOnly = true)
    public Page<StateChange> getStateChanges(TenantContext context, UUID spaceId, OffsetDateTime from,
                                             OffsetDateTime to, Pageable pageable) {
        getSpace(context, spaceId);
        OffsetDateTime effectiveTo = to != null ? to : OffsetDateTime.now(clock).plusSeconds(1);
        OffsetDateTime effectiveFrom = from != null ? from : effectiveTo.minusDays(7);
        if (!effectiveFrom.isBefore(effectiveTo)) {
            throw ProblemException.validation("state_change.invalid_range", "from must be before to");
        }
        return stateChangeRepository.findForSpace(spaceId, effectiveFrom, effectiveTo, context, pageable);
    }

    private String requireReason(String reason) {
        if (!StringUtils.hasText(reason)) {
            throw ProblemException.validation("space.reason_required", "A reason is required");
        }
        String trimmed = reason.trim();
        if (trimmed.length() > MAX_REASON_LENGTH) {
            throw ProblemException.validation("space.reason_too_long", "reason must be at most 500 characters");
        }
        return trimmed;
    }

    public record CreateSpaceCommand(UUID siteId, String code, String name, Integer autoReleaseMinutes) {
    }
}
