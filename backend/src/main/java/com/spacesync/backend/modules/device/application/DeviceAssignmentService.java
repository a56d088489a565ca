package com.spacesync.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.AssignmentAction;
import com.spacesync.backend.modules.device.domain.DeviceAssignment;
import com.spacesync.backend.modules.device.domain.DeviceKind;
import com.spacesync.backend.modules.device.domain.DisplayAssignedEvent;
import com.spacesync.backend.modules.device.domain.DisplayDevice;
import com.spacesync.backend.modules.device.domain.SensorDevice;
import com.spacesync.backend.modules.device.infrastructure.persistence.DeviceAssignmentRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.DisplayDeviceRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.SensorDeviceRepository;
import com.spacesync.backend.modules.space.application.SpaceStateService;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.StateChangeSource;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Binds devices to spaces. The device side, the space side and the history row commit together.
 * Races on the same device or the same space slot are decided by the version columns and the
 * unique slot indexes; the loser gets a conflict.
 */
@Service
public class DeviceAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAssignmentService.class);

    private final SensorDeviceRepository sensorDeviceRepository;
    private final DisplayDeviceRepository displayDeviceRepository;
    private final DeviceAssignmentRepository deviceAssignmentRepository;
    private final SpaceRepository spaceRepository;
    private final SpaceStateService spaceStateService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DeviceAssignmentService(
            SensorDeviceRepository sensorDeviceRepository,
            DisplayDeviceRepository displayDeviceRepository,
            DeviceAssignmentRepository deviceAssignmentRepository,
            SpaceRepository spaceRepository,
            SpaceStateService spaceStateService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.sensorDeviceRepository = sensorDeviceRepository;
        this.displayDeviceRepository = displayDeviceRepository;
        this.deviceAssignmentRepository = deviceAssignmentRepository;
        this.spaceRepository = spaceRepository;
        this.spaceStateService = spaceStateService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public DeviceAssignment assign(TenantContext context, DeviceKind kind, UUID deviceId, UUID spaceId, String reason) {
        AbstractDevice device = loadDevice(context, kind, deviceId);
        Space space = spaceRepository.findById(spaceId, context)
                .orElseThrow(() -> ProblemException.notFound("space.not_found", "Space not found: " + spaceId));
        if (!device.getTenantId().equals(space.getTenantId())) {
            throw ProblemException.validation("device.tenant_mismatch", "Device and space belong to different tenants");
        }
        if (device.isAssigned()) {
            throw ProblemException.conflict("device.already_assigned", "Device is already assigned to a space")
                    .with("spaceId", device.getAssignedSpaceId());
        }
        UUID occupyingDevice = kind == DeviceKind.SENSOR ? space.getSensorDeviceId() : space.getDisplayDeviceId();
        if (occupyingDevice != null) {
            throw slotTaken(kind).with("deviceId", occupyingDevice);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        device.assignTo(space.getId(), now);
        if (kind == DeviceKind.SENSOR) {
            space.attachSensor(device.getId(), now);
        } else {
            space.attachDisplay(device.getId(), now);
        }
        flushAssignment(kind, device, space);

        DeviceAssignment history = deviceAssignmentRepository.save(DeviceAssignment.record(
                device, space.getId(), AssignmentAction.ASSIGNED, context.actorId(), normalizeReason(reason), now));

        TenantContext owner = context.actingFor(space.getTenantId());
        if (kind == DeviceKind.SENSOR) {
            spaceStateService.recomputeWithin(owner, space, StateChangeSource.ASSIGNMENT, null);
        } else {
            eventPublisher.publishEvent(new DisplayAssignedEvent(
                    space.getTenantId(), space.getId(), device.getId(), space.getCurrentState()));
        }
        log.info("Assigned {} {} to space {} by {}", kind, device.getDevEui(), space.getId(), context.actorId());
        return history;
    }

    @Transactional
    public DeviceAssignment unassign(TenantContext context, DeviceKind kind, UUID deviceId, String reason) {
        AbstractDevice device = loadDevice(context, kind, deviceId);
        if (!device.isAssigned()) {
            throw ProblemException.conflict("device.not_assigned", "Device is not assigned to a space");
        }
        UUID spaceId = device.getAssignedSpaceId();
        OffsetDateTime now = OffsetDateTime.now(clock);
        device.unassign(now);

        Optional<Space> space = spaceRepository.findById(spaceId, context.actingFor(device.getTenantId()));
        space.ifPresent(s -> {
            if (kind == DeviceKind.SENSOR && deviceId.equals(s.getSensorDeviceId())) {
                s.detachSensor(now);
            } else if (kind == DeviceKind.DISPLAY && deviceId.equals(s.getDisplayDeviceId())) {
                s.detachDisplay(now);
            }
        });
        flushAssignment(kind, device, space.orElse(null));

        DeviceAssignment history = deviceAssignmentRepository.save(DeviceAssignment.record(
                device, spaceId, AssignmentAction.UNASSIGNED, context.actorId(), normalizeReason(reason), now));

        if (kind == DeviceKind.SENSOR && space.isPresent()) {
            spaceStateService.recomputeWithin(context.actingFor(device.getTenantId()), space.get(),
                    StateChangeSource.ASSIGNMENT, null);
        }
        log.info("Unassigned {} {} from space {} by {}", kind, device.getDevEui(), spaceId, context.actorId());
        return history;
    }

    private AbstractDevice loadDevice(TenantContext context, DeviceKind kind, UUID deviceId) {
        return switch (kind) {
            case SENSOR -> sensorDeviceRepository.findById(deviceId, context)
                    .orElseThrow(() -> DeviceRegistryService.deviceNotFound(deviceId));
            case DISPLAY -> displayDeviceRepository.findById(deviceId, context)
                    .orElseThrow(() -> DeviceRegistryService.deviceNotFound(deviceId));
        };
    }

    private void flushAssignment(DeviceKind kind, AbstractDevice device, Space space) {
        try {
            if (kind == DeviceKind.SENSOR) {
                sensorDeviceRepository.saveAndFlush((SensorDevice) device);
            } else {
                displayDeviceRepository.saveAndFlush((DisplayDevice) device);
            }
            if (space != null) {
                spaceRepository.saveAndFlush(space);
            }
        } catch (OptimisticLockingFailureException ex) {
            throw ProblemException.conflict("device.assignment_conflict",
                    "Device or space was changed by a concurrent assignment");
        } catch (DataIntegrityViolationException ex) {
            if (isSlotConstraintViolation(ex)) {
                throw slotTaken(kind);
            }
            throw ProblemException.conflict("device.assignment_conflict",
                    "Device or space was changed by a concurrent assignment");
        }
    }

    private ProblemException slotTaken(DeviceKind kind) {
        return ProblemException.conflict("space.device_slot_taken",
                "Space already has a " + kind.name().toLowerCase() + " device");
    }

    private boolean isSlotConstraintViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && (message.contains("uq_space_sensor_device")
                || message.contains("uq_space_display_device"));
    }

    private String normalizeReason(String reason) {
        return StringUtils.hasText(reason) ? reason.trim() : null;
    }
}
