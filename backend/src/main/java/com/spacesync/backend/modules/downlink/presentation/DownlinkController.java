package com.spacesync.backend.modules.downlink.presentation;

import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService.EnqueueCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.presentation.dto.ClearQueueResponse;
import com.spacesync.backend.modules.downlink.presentation.dto.DownlinkCommandResponse;
import com.spacesync.backend.modules.downlink.presentation.dto.DownlinkListResponse;
import com.spacesync.backend.modules.downlink.presentation.dto.EnqueueDownlinkRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/downlinks")
@Tag(name = "Downlinks", description = "Display command queue")
public class DownlinkController {

    private static final int DEFAULT_OPERATOR_PRIORITY = 5;
    private static final int MAX_PAGE_SIZE = 100;

    private final DownlinkQueueService downlinkQueueService;

    public DownlinkController(DownlinkQueueService downlinkQueueService) {
        this.downlinkQueueService = downlinkQueueService;
    }

    @PostMapping
    @Operation(summary = "Queue a command for a display")
    public ResponseEntity<DownlinkCommandResponse> enqueue(TenantContext tenant,
                                                           @Valid @RequestBody EnqueueDownlinkRequest request) {
        int priority = request.priority() != null ? request.priority() : DEFAULT_OPERATOR_PRIORITY;
        DownlinkCommand command = downlinkQueueService.enqueue(tenant,
                new EnqueueCommand(request.deviceId(), request.command(), request.payload(), priority));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(DownlinkCommandResponse.from(command));
    }

    @GetMapping
    public ResponseEntity<DownlinkListResponse> history(
            TenantContext tenant,
            @RequestParam("deviceId") UUID deviceId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(toList(downlinkQueueService.history(tenant, deviceId,
                PageRequest.of(safePage, safeSize)), safePage, safeSize));
    }

    @GetMapping("/failed")
    @Operation(summary = "Commands that exhausted their attempts")
    public ResponseEntity<DownlinkListResponse> failed(
            TenantContext tenant,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(toList(downlinkQueueService.failed(tenant, PageRequest.of(safePage, safeSize)),
                safePage, safeSize));
    }

    @DeleteMapping("/queue/{deviceId}")
    @Operation(summary = "Abandon every queued command of a display")
    public ResponseEntity<ClearQueueResponse> clearQueue(TenantContext tenant, @PathVariable("deviceId") UUID deviceId) {
        int abandoned = downlinkQueueService.clearQueue(tenant, deviceId);
        return ResponseEntity.ok(new ClearQueueResponse(deviceId, abandoned));
    }

    private DownlinkListResponse toList(Page<DownlinkCommand> page, int pageNumber, int size) {
        List<DownlinkCommandResponse> items = page.getContent().stream().map(DownlinkCommandResponse::from).toList();
        return new DownlinkListResponse(items, pageNumber, size, page.getTotalElements());
    }
}
