package com.spacesync.backend.modules.device.presentation;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.application.DeviceAssignmentService;
import com.spacesync.backend.modules.device.application.DeviceRegistryService;
import com.spacesync.backend.modules.device.application.DeviceRegistryService.RegisterDeviceCommand;
import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.DeviceKind;
import com.spacesync.backend.modules.device.domain.OrphanDevice;
import com.spacesync.backend.modules.device.presentation.dto.AssignDeviceRequest;
import com.spacesync.backend.modules.device.presentation.dto.DeviceAssignmentResponse;
import com.spacesync.backend.modules.device.presentation.dto.DeviceResponse;
import com.spacesync.backend.modules.device.presentation.dto.OrphanDeviceListResponse;
import com.spacesync.backend.modules.device.presentation.dto.OrphanDeviceResponse;
import com.spacesync.backend.modules.device.presentation.dto.RegisterDeviceRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/devices")
@Tag(name = "Devices", description = "Device registry, assignment and orphan triage")
public class DeviceController {

    private static final int MAX_PAGE_SIZE = 100;

    private final DeviceRegistryService deviceRegistryService;
    private final DeviceAssignmentService deviceAssignmentService;

    public DeviceController(DeviceRegistryService deviceRegistryService,
                            DeviceAssignmentService deviceAssignmentService) {
        this.deviceRegistryService = deviceRegistryService;
        this.deviceAssignmentService = deviceAssignmentService;
    }

    @PostMapping
    @Operation(summary = "Register a sensor or display")
    public ResponseEntity<DeviceResponse> registerDevice(TenantContext tenant,
                                                         @Valid @RequestBody RegisterDeviceRequest request) {
        AbstractDevice device = deviceRegistryService.registerDevice(tenant,
                new RegisterDeviceCommand(request.kind(), request.devEui(), request.name()));
        URI location = URI.create("/devices/" + pathSegment(device.getKind()) + "/" + device.getId());
        return ResponseEntity.created(location).body(DeviceResponse.from(device));
    }

    @GetMapping
    public ResponseEntity<List<DeviceResponse>> listDevices(
            TenantContext tenant,
            @RequestParam(name = "kind", defaultValue = "SENSOR") DeviceKind kind
    ) {
        List<DeviceResponse> devices = deviceRegistryService.listDevices(tenant, kind).stream()
                .map(DeviceResponse::from)
                .toList();
        return ResponseEntity.ok(devices);
    }

    @GetMapping("/orphans")
    @Operation(summary = "Unregistered hardware ids that sent telemetry (platform admins)")
    public ResponseEntity<OrphanDeviceListResponse> listOrphans(
            TenantContext tenant,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<OrphanDevice> result = deviceRegistryService.listOrphans(tenant, PageRequest.of(safePage, safeSize));
        List<OrphanDeviceResponse> items = result.getContent().stream().map(OrphanDeviceResponse::from).toList();
        return ResponseEntity.ok(new OrphanDeviceListResponse(items, safePage, safeSize, result.getTotalElements()));
    }

    @GetMapping("/{kind}/{deviceId}")
    public ResponseEntity<DeviceResponse> getDevice(TenantContext tenant,
                                                    @PathVariable("kind") String kind,
                                                    @PathVariable("deviceId") UUID deviceId) {
        return ResponseEntity.ok(DeviceResponse.from(deviceRegistryService.getDevice(tenant, parseKind(kind), deviceId)));
    }

    @PutMapping("/{kind}/{deviceId}/assignment")
    @Operation(summary = "Assign the device to a space")
    public ResponseEntity<DeviceAssignmentResponse> assign(TenantContext tenant,
                                                           @PathVariable("kind") String kind,
                                                           @PathVariable("deviceId") UUID deviceId,
                                                           @Valid @RequestBody AssignDeviceRequest request) {
        return ResponseEntity.ok(DeviceAssignmentResponse.from(deviceAssignmentService.assign(
                tenant, parseKind(kind), deviceId, request.spaceId(), request.reason())));
    }

    @DeleteMapping("/{kind}/{deviceId}/assignment")
    @Operation(summary = "Remove the device from its space")
    public ResponseEntity<DeviceAssignmentResponse> unassign(TenantContext tenant,
                                                             @PathVariable("kind") String kind,
                                                             @PathVariable("deviceId") UUID deviceId,
                                                             @RequestParam(name = "reason", required = false) String reason) {
        return ResponseEntity.ok(DeviceAssignmentResponse.from(
                deviceAssignmentService.unassign(tenant, parseKind(kind), deviceId, reason)));
    }

    @GetMapping("/{kind}/{deviceId}/assignments")
    public ResponseEntity<List<DeviceAssignmentResponse>> assignmentHistory(TenantContext tenant,
                                                                            @PathVariable("kind") String kind,
                                                                            @PathVariable("deviceId") UUID deviceId) {
        List<DeviceAssignmentResponse> history = deviceRegistryService
                .getAssignmentHistory(tenant, parseKind(kind), deviceId).stream()
                .map(DeviceAssignmentResponse::from)
                .toList();
        return ResponseEntity.ok(history);
    }

    private DeviceKind parseKind(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "sensors", "sensor" -> DeviceKind.SENSOR;
            case "displays", "display" -> DeviceKind.DISPLAY;
            default -> throw ProblemException.notFound("device.unknown_kind", "Unknown device kind: " + raw);
        };
    }

    private String pathSegment(DeviceKind kind) {
        return kind == DeviceKind.SENSOR ? "sensors" : "displays";
    }
}
