package com.spacesync.backend.modules.telemetry.presentation;

import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.modules.telemetry.application.WebhookIngestionService;
import com.spacesync.backend.modules.telemetry.presentation.dto.WebhookAck;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks")
@Tag(name = "Webhooks", description = "Network server integration")
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Signature";
    static final String TENANT_HEADER = "X-Tenant-Id";

    private final WebhookIngestionService ingestionService;

    public WebhookController(WebhookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(path = "/chirpstack", consumes = MediaType.ALL_VALUE)
    @Operation(summary = "Receive a signed uplink, join or downlink acknowledgement")
    public ResponseEntity<WebhookAck> receive(
            @RequestParam("event") String event,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(name = TENANT_HEADER, required = false) String tenantHeader,
            @RequestBody byte[] body
    ) {
        UUID tenantHint = parseTenantHint(tenantHeader);
        return ResponseEntity.ok(WebhookAck.from(ingestionService.ingest(event, body, signature, tenantHint)));
    }

    private static UUID parseTenantHint(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException ex) {
            throw ProblemException.validation("tenant.invalid_header", "X-Tenant-Id must be a UUID");
        }
    }
}
