package com.spacesync.backend.modules.space.presentation;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.space.application.SpaceService;
import com.spacesync.backend.modules.space.application.SpaceService.CreateSpaceCommand;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.StateChange;
import com.spacesync.backend.modules.space.presentation.dto.CreateSpaceRequest;
import com.spacesync.backend.modules.space.presentation.dto.MaintenanceOverrideRequest;
import com.spacesync.backend.modules.space.presentation.dto.SpaceEnablementRequest;
import com.spacesync.backend.modules.space.presentation.dto.SpaceResponse;
import com.spacesync.backend.modules.space.presentation.dto.StateChangeListResponse;
import com.spacesync.backend.modules.space.presentation.dto.StateChangeResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
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
@RequestMapping("/spaces")
@Tag(name = "Spaces", description = "Derived space state, overrides and audit log")
public class SpaceController {

    private static final int MAX_PAGE_SIZE = 200;

    private final SpaceService spaceService;

    public SpaceController(SpaceService spaceService) {
        this.spaceService = spaceService;
    }

    @PostMapping
    @Operation(summary = "Register a space on a site")
    public ResponseEntity<SpaceResponse> createSpace(TenantContext tenant, @Valid @RequestBody CreateSpaceRequest request) {
        Space space = spaceService.createSpace(tenant, new CreateSpaceCommand(
                request.siteId(), request.code().trim(), request.name(), request.autoReleaseMinutes()));
        return ResponseEntity.created(URI.create("/spaces/" + space.getId())).body(SpaceResponse.from(space));
    }

    @GetMapping
    public ResponseEntity<List<SpaceResponse>> listSpaces(
            TenantContext tenant,
            @RequestParam(name = "siteId", required = false) UUID siteId
    ) {
        List<SpaceResponse> spaces = spaceService.listSpaces(tenant, siteId).stream()
                .map(SpaceResponse::from)
                .toList();
        return ResponseEntity.ok(spaces);
    }

    @GetMapping("/{spaceId}")
    @Operation(summary = "Current derived state of a space")
    public ResponseEntity<SpaceResponse> getSpace(TenantContext tenant, @PathVariable("spaceId") UUID spaceId) {
        return ResponseEntity.ok(SpaceResponse.from(spaceService.getSpace(tenant, spaceId)));
    }

    @PutMapping("/{spaceId}/override")
    @Operation(summary = "Set or clear the maintenance override")
    public ResponseEntity<SpaceResponse> setOverride(
            TenantContext tenant,
            @PathVariable("spaceId") UUID spaceId,
            @Valid @RequestBody MaintenanceOverrideRequest request
    ) {
        Space space = spaceService.setMaintenanceOverride(tenant, spaceId, request.active(), request.reason());
        return ResponseEntity.ok(SpaceResponse.from(space));
    }

    @PutMapping("/{spaceId}/enabled")
    @Operation(summary = "Enable or disable a space")
    public ResponseEntity<SpaceResponse> setEnabled(
            TenantContext tenant,
            @PathVariable("spaceId") UUID spaceId,
            @Valid @RequestBody SpaceEnablementRequest request
    ) {
        Space space = spaceService.setEnabled(tenant, spaceId, request.enabled(), request.reason());
        return ResponseEntity.ok(SpaceResponse.from(space));
    }

    @DeleteMapping("/{spaceId}")
    @Operation(summary = "Delete a space without devices or active bookings")
    public ResponseEntity<Void> deleteSpace(TenantContext tenant, @PathVariable("spaceId") UUID spaceId) {
        spaceService.deleteSpace(tenant, spaceId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{spaceId}/state-changes")
    @Operation(summary = "State transition log, newest first")
    public ResponseEntity<StateChangeListResponse> getStateChanges(
            TenantContext tenant,
            @PathVariable("spaceId") UUID spaceId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<StateChange> result = spaceService.getStateChanges(tenant, spaceId, from, to,
                PageRequest.of(safePage, safeSize));
        List<StateChangeResponse> items = result.getContent().stream()
                .map(StateChangeResponse::from)
                .toList();
        return ResponseEntity.ok(new StateChangeListResponse(items, safePage, safeSize, result.getTotalElements()));
    }
}
