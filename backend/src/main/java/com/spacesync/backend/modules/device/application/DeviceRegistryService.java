package com.spacesync.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.DevEui;
import com.spacesync.backend.modules.device.domain.DeviceAssignment;
import com.spacesync.backend.modules.device.domain.DeviceKind;
import com.spacesync.backend.modules.device.domain.DisplayDevice;
import com.spacesync.backend.modules.device.domain.OrphanDevice;
import com.spacesync.backend.modules.device.domain.SensorDevice;
import com.spacesync.backend.modules.device.infrastructure.persistence.DeviceAssignmentRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.DisplayDeviceRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.OrphanDeviceRepository;
import com.spacesync.backend.modules.device.infrastructure.persistence.SensorDeviceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Device records and orphan triage. Registering a hardware id that was reporting as an orphan
 * removes its orphan row.
 */
@Service
public class DeviceRegistryService {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistryService.class);

    private final SensorDeviceRepository sensorDeviceRepository;
    private final DisplayDeviceRepository displayDeviceRepository;
    private final DeviceAssignmentRepository deviceAssignmentRepository;
    private final OrphanDeviceRepository orphanDeviceRepository;
    private final Clock clock;

    public DeviceRegistryService(
            SensorDeviceRepository sensorDeviceRepository,
            DisplayDeviceRepository displayDeviceRepository,
            DeviceAssignmentRepository deviceAssignmentRepository,
            OrphanDeviceRepository orphanDeviceRepository,
            Clock clock
    ) {
        this.sensorDeviceRepository = sensorDeviceRepository;
        this.displayDeviceRepository = displayDeviceRepository;
        this.deviceAssignmentRepository = deviceAssignmentRepository;
        this.orphanDeviceRepository = orphanDeviceRepository;
        this.clock = clock;
    }

    @Transactional
    public AbstractDevice registerDevice(TenantContext context, RegisterDeviceCommand command) {
        String devEui = normalizeDevEui(command.devEui());
        if (sensorDeviceRepository.existsByDevEui(devEui) || displayDeviceRepository.existsByDevEui(devEui)) {
            throw ProblemException.conflict("device.eui_taken", "A device with this devEui is already registered");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        AbstractDevice saved;
        try {
            saved = switch (command.kind()) {
                case SENSOR -> sensorDeviceRepository.saveAndFlush(
                        SensorDevice.register(context.tenantId(), devEui, command.name(), now));
                case DISPLAY -> displayDeviceRepository.saveAndFlush(
                        DisplayDevice.register(context.tenantId(), devEui, command.name(), now));
            };
        } catch (DataIntegrityViolationException ex) {
            if (isDevEuiConstraintViolation(ex)) {
                throw ProblemException.conflict("device.eui_taken", "A device with this devEui is already registered");
            }
            throw ex;
        }
        if (orphanDeviceRepository.deleteByDevEui(devEui) > 0) {
            log.info("Orphan {} claimed by tenant {} as {}", devEui, context.tenantId(), command.kind());
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public AbstractDevice getDevice(TenantContext context, DeviceKind kind, UUID deviceId) {
        return switch (kind) {
            case SENSOR -> sensorDeviceRepository.findById(deviceId, context)
                    .orElseThrow(() -> deviceNotFound(deviceId));
            case DISPLAY -> displayDeviceRepository.findById(deviceId, context)
                    .orElseThrow(() -> deviceNotFound(deviceId));
        };
    }

    @Transactional(readOnly = true)
    public List<? extends AbstractDevice> listDevices(TenantContext context, DeviceKind kind) {
        return switch (kind) {
            case SENSOR -> sensorDeviceRepository.findAll(context);
            case DISPLAY -> displayDeviceRepository.findAll(context);
        };
    }

    @Transactional(readOnly = true)
    public List<DeviceAssignment> getAssignmentHistory(TenantContext context, DeviceKind kind, UUID deviceId) {
        getDevice(context, kind, deviceId);
        return deviceAssignmentRepository.findHistory(deviceId, context);
    }

    @Transactional(readOnly = true)
    public Page<OrphanDevice> listOrphans(TenantContext context, Pageable pageable) {
        if (!context.platformAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "orphan.platform_only",
                    "Orphan devices are visible to platform administrators only");
        }
        return orphanDeviceRepository.findRecent(pageable);
    }

    static ProblemException deviceNotFound(UUID deviceId) {
        return ProblemException.notFound("device.not_found", "Device not found: " + deviceId);
    }

    private String normalizeDevEui(String raw) {
        try {
            return DevEui.normalize(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.validation("device.invalid_dev_eui", ex.getMessage());
        }
    }

    private boolean isDevEuiConstraintViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && (message.contains("uq_sensor_device_dev_eui")
                || message.contains("uq_display_device_dev_eui"));
    }

    public record RegisterDeviceCommand(DeviceKind kind, String devEui, String name) {
    }
}
