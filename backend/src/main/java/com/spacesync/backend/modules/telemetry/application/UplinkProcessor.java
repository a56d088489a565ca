package com.spacesync.backend.modules.telemetry.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.jpa.OptimisticRetryExecutor;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.DisplayDevice;
import com.spacesync.backend.modules.device.domain.SensorDevice;
import com.spacesync.backend.modules.device.infrastructure.persistence.DisplayDeviceRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.OrphanDeviceRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.SensorDeviceRepository;
import com.spacesync.backend.modules.space.application.SpaceStateService;
import com.spacesync.backend.modules.space.domain.SensorState;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.StateChangeSource;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;
import com.spacesync.backend.modules.telemetry.domain.IngestOutcome;
import com.spacesync.backend.modules.telemetry.domain.IngestResult;
import com.spacesync.backend.modules.telemetry.domain.JoinEvent;
import com.spacesync.backend.modules.telemetry.domain.SensorReading;
import com.spacesync.backend.modules.telemetry.domain.UplinkEvent;
import com.spacesync.backend.modules.telemetry.domain.WebhookEventType;
import com.spacesync.backend.modules.telemetry.infrastructure.persistence.SensorReadingRepository;
import com.spacesync.backend.modules.tenant.domain.Tenant;
import com.spacesync.backend.modules.tenant.infrastructure.persistence.TenantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies verified, parsed deliveries to storage.
 *
 * <p>Each delivery is one transaction: frame-counter compare-and-set, reading insert and space
 * recompute commit together. A version conflict on the space rolls the whole unit back, including
 * the counter advance, and the unit is replayed.
 */
@Component
public class UplinkProcessor {

    private static final Logger log = LoggerFactory.getLogger(UplinkProcessor.class);

    private final SensorDeviceRepository sensorDeviceRepository;
    private final DisplayDeviceRepository displayDeviceRepository;
    private final OrphanDeviceRepository orphanDeviceRepository;
    private final SensorReadingRepository sensorReadingRepository;
    private final SpaceRepository spaceRepository;
    private final TenantRepository tenantRepository;
    private final SpaceStateService spaceStateService;
    private final OptimisticRetryExecutor retryExecutor;
    private final Clock clock;

    public UplinkProcessor(
            SensorDeviceRepository sensorDeviceRepository,
            DisplayDeviceRepository displayDeviceRepository,
            OrphanDeviceRepository orphanDeviceRepository,
            SensorReadingRepository sensorReadingRepository,
            SpaceRepository spaceRepository,
            TenantRepository tenantRepository,
            SpaceStateService spaceStateService,
            OptimisticRetryExecutor retryExecutor,
            Clock clock
    ) {
        this.sensorDeviceRepository = sensorDeviceRepository;
        this.displayDeviceRepository = displayDeviceRepository;
        this.orphanDeviceRepository = orphanDeviceRepository;
        this.sensorReadingRepository = sensorReadingRepository;
        this.spaceRepository = spaceRepository;
        this.tenantRepository = tenantRepository;
        this.spaceStateService = spaceStateService;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public IngestResult processUplink(UplinkEvent uplink, UUID tenantHint, String rawPayload) {
        return retryExecutor.execute("uplink " + uplink.devEui() + "#" + uplink.fcnt(),
                () -> applyUplink(uplink, tenantHint, rawPayload));
    }

    public IngestResult processJoin(JoinEvent join, UUID tenantHint, String rawPayload) {
        return retryExecutor.execute("join " + join.devEui(), () -> applyJoin(join, tenantHint, rawPayload));
    }

    private IngestResult applyUplink(UplinkEvent uplink, UUID tenantHint, String rawPayload) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TenantContext platform = TenantContext.platform();

        Optional<SensorDevice> sensor = sensorDeviceRepository.findByDevEui(uplink.devEui(), platform);
        if (sensor.isEmpty()) {
            Optional<DisplayDevice> display = displayDeviceRepository.findByDevEui(uplink.devEui(), platform);
            if (display.isEmpty()) {
                return recordOrphan(uplink.devEui(), WebhookEventType.UP, rawPayload, now);
            }
            if (!belongsToActiveTenant(display.get(), tenantHint)) {
                return IngestResult.of(IngestOutcome.IGNORED, uplink.devEui());
            }
            displayDeviceRepository.markSeen(display.get().getId(), now);
            return new IngestResult(IngestOutcome.UNASSIGNED, uplink.devEui(), uplink.fcnt());
        }

        SensorDevice device = sensor.get();
        if (!belongsToActiveTenant(device, tenantHint)) {
            return IngestResult.of(IngestOutcome.IGNORED, uplink.devEui());
        }
        int advanced = sensorDeviceRepository.advanceFrameCounter(device.getId(), uplink.fcnt(), uplink.rssi(),
                uplink.snr(), now);
        if (advanced == 0) {
            log.debug("Discarded frame {} from {}: not above last accepted counter", uplink.fcnt(), uplink.devEui());
            return new IngestResult(IngestOutcome.DUPLICATE, uplink.devEui(), uplink.fcnt());
        }

        TenantContext owner = TenantContext.of(device.getTenantId(), null);
        Optional<Space> space = Optional.ofNullable(device.getAssignedSpaceId())
                .flatMap(spaceId -> spaceRepository.findById(spaceId, owner));
        sensorReadingRepository.save(SensorReading.accepted(device.getTenantId(), device.getId(),
                space.map(Space::getId).orElse(null), uplink, now));
        sensorDeviceRepository.markOperational(device.getId(), now);

        if (space.isEmpty()) {
            return new IngestResult(IngestOutcome.UNASSIGNED, uplink.devEui(), uplink.fcnt());
        }
        Space assigned = space.get();
        if (uplink.occupied() != null) {
            assigned.applySensorReading(SensorState.of(uplink.occupied()), now);
        }
        spaceStateService.recomputeWithin(owner, assigned, StateChangeSource.SENSOR, null);
        return new IngestResult(IngestOutcome.ACCEPTED, uplink.devEui(), uplink.fcnt());
    }

    private IngestResult applyJoin(JoinEvent join, UUID tenantHint, String rawPayload) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TenantContext platform = TenantContext.platform();

        Optional<SensorDevice> sensor = sensorDeviceRepository.findByDevEui(join.devEui(), platform);
        if (sensor.isPresent()) {
            if (!belongsToActiveTenant(sensor.get(), tenantHint)) {
                return IngestResult.of(IngestOutcome.IGNORED, join.devEui());
            }
            sensorDeviceRepository.markOperational(sensor.get().getId(), now);
            log.info("Sensor {} joined", join.devEui());
            return IngestResult.of(IngestOutcome.ACCEPTED, join.devEui());
        }
        Optional<DisplayDevice> display = displayDeviceRepository.findByDevEui(join.devEui(), platform);
        if (display.isPresent()) {
            if (!belongsToActiveTenant(display.get(), tenantHint)) {
                return IngestResult.of(IngestOutcome.IGNORED, join.devEui());
            }
            displayDeviceRepository.markSeen(display.get().getId(), now);
            log.info("Display {} joined", join.devEui());
            return IngestResult.of(IngestOutcome.ACCEPTED, join.devEui());
        }
        return recordOrphan(join.devEui(), WebhookEventType.JOIN, rawPayload, now);
    }

    private IngestResult recordOrphan(String devEui, WebhookEventType event, String rawPayload, OffsetDateTime now) {
        orphanDeviceRepository.recordSighting(devEui, event.name(), rawPayload, now);
        log.info("Orphan device {} ({})", devEui, event);
        return IngestResult.of(IngestOutcome.ORPHAN, devEui);
    }

    private boolean belongsToActiveTenant(AbstractDevice device, UUID tenantHint) {
        if (tenantHint != null && !tenantHint.equals(device.getTenantId())) {
            log.warn("[ALERT] Webhook for device {} carried tenant {} but device belongs to {}",
                    device.getDevEui(), tenantHint, device.getTenantId());
            return false;
        }
        boolean active = tenantRepository.findById(device.getTenantId(), TenantContext.platform())
                .map(Tenant::isActive)
                .orElse(false);
        if (!active) {
            log.info("Ignored telemetry from {}: tenant {} is inactive", device.getDevEui(), device.getTenantId());
        }
        return active;
    }
}
