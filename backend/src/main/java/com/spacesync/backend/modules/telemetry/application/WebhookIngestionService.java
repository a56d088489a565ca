package com.spacesync.backend.modules.telemetry.application;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.error.RetryableProblemException;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService;
import com.spacesync.backend.modules.telemetry.domain.AckEvent;
import com.spacesync.backend.modules.telemetry.domain.IngestOutcome;
import com.spacesync.backend.modules.telemetry.domain.IngestResult;
import com.spacesync.backend.modules.telemetry.domain.JoinEvent;
import com.spacesync.backend.modules.telemetry.domain.UplinkEvent;
import com.spacesync.backend.modules.telemetry.domain.WebhookEventType;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.SpoolFullException;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.SpooledEvent;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.WebhookSpool;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Entry point of the webhook gate.
 *
 * <p>Signature and payload are checked before anything touches storage. A verified delivery is then
 * processed, or spooled when storage is unavailable or the spool still holds older deliveries, and the
 * sender is acknowledged either way. Only a full spool turns into a 503.
 */
@Service
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);
    private static final String UPLINK_METRIC = "spacesync.webhook.uplinks";

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadParser payloadParser;
    private final UplinkProcessor uplinkProcessor;
    private final DownlinkQueueService downlinkQueueService;
    private final WebhookSpool spool;
    private final WebhookProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WebhookIngestionService(
            WebhookSignatureVerifier signatureVerifier,
            WebhookPayloadParser payloadParser,
            UplinkProcessor uplinkProcessor,
            DownlinkQueueService downlinkQueueService,
            WebhookSpool spool,
            WebhookProperties properties,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.signatureVerifier = signatureVerifier;
        this.payloadParser = payloadParser;
        this.uplinkProcessor = uplinkProcessor;
        this.downlinkQueueService = downlinkQueueService;
        this.spool = spool;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public IngestResult ingest(String event, byte[] body, String signature, UUID tenantHint) {
        signatureVerifier.verify(body, signature, tenantHint);
        WebhookEventType type;
        try {
            type = WebhookEventType.parse(event);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.validation("webhook.unsupported_event", ex.getMessage());
        }
        JsonNode root = payloadParser.readTree(body);
        Object parsed = parse(type, root);

        if (spool.hasBacklog()) {
            return spoolDelivery(type, tenantHint, body, devEuiOf(parsed));
        }
        IngestResult result;
        try {
            result = process(type, parsed, tenantHint, root);
        } catch (RuntimeException ex) {
            if (!TransientFailures.isTransient(ex)) {
                throw ex;
            }
            log.warn("Storage unavailable while ingesting {} from {}, spooling", type, devEuiOf(parsed), ex);
            return spoolDelivery(type, tenantHint, body, devEuiOf(parsed));
        }
        count(result.outcome());
        return result;
    }

    /**
     * Replays spooled deliveries in order, stopping at the first one that still fails transiently.
     */
    public int replaySpool() {
        try {
            return spool.replay(this::replayOne);
        } catch (IOException ex) {
            log.error("[ALERT] Webhook spool unreadable", ex);
            return 0;
        }
    }

    private boolean replayOne(SpooledEvent spooled) {
        try {
            JsonNode root = payloadParser.readTree(spooled.body());
            IngestResult result = process(spooled.event(), parse(spooled.event(), root), spooled.tenantHint(), root);
            count(result.outcome());
            log.debug("Replayed spooled {} received at {}: {}", spooled.event(), spooled.receivedAt(), result.outcome());
            return true;
        } catch (ProblemException ex) {
            log.warn("[ALERT] Dropping spooled {} received at {}: {}", spooled.event(), spooled.receivedAt(),
                    ex.getCode());
            return true;
        } catch (RuntimeException ex) {
            if (TransientFailures.isTransient(ex)) {
                log.debug("Spool replay paused: storage still unavailable");
                return false;
            }
            log.error("[ALERT] Dropping spooled {} received at {} after unexpected failure", spooled.event(),
                    spooled.receivedAt(), ex);
            return true;
        }
    }

    private Object parse(WebhookEventType type, JsonNode root) {
        return switch (type) {
            case UP -> payloadParser.parseUplink(root);
            case JOIN -> payloadParser.parseJoin(root);
            case ACK -> payloadParser.parseAck(root);
        };
    }

    private IngestResult process(WebhookEventType type, Object parsed, UUID tenantHint, JsonNode root) {
        String raw = root.toString();
        return switch (type) {
            case UP -> uplinkProcessor.processUplink((UplinkEvent) parsed, tenantHint, raw);
            case JOIN -> uplinkProcessor.processJoin((JoinEvent) parsed,
                    tenantHint, raw);
            case ACK -> confirm((AckEvent) parsed);
        };
    }

    private IngestResult confirm(AckEvent ack) {
        boolean matched = downlinkQueueService.confirm(ack.queueItemId(), ack.acknowledged()).isPresent();
        return IngestResult.of(matched ? IngestOutcome.CONFIRMED : IngestOutcome.IGNORED, ack.devEui());
    }

    private IngestResult spoolDelivery(WebhookEventType type, UUID tenantHint, byte[] body, String devEui) {
        try {
            spool.append(new SpooledEvent(type, tenantHint, body, OffsetDateTime.now(clock)));
        } catch (SpoolFullException ex) {
            log.error("[ALERT] Webhook spool full, rejecting {} from {}: {}", type, devEui, ex.getMessage());
            throw unavailable();
        } catch (IOException ex) {
            log.error("[ALERT] Webhook spool write failed for {} from {}", type, devEui, ex);
            throw unavailable();
        }
        count(IngestOutcome.SPOOLED);
        return IngestResult.of(IngestOutcome.SPOOLED, devEui);
    }

    private RetryableProblemException unavailable() {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "webhook.backlog_full",
                "Telemetry backlog is full, retry later",
                properties.getSpool().getRetryAfter());
    }

    private void count(IngestOutcome outcome) {
        meterRegistry.counter(UPLINK_METRIC, "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }

    private static String devEuiOf(Object parsed) {
        if (parsed instanceof UplinkEvent uplink) {
            return uplink.devEui();
        }
        if (parsed instanceof AckEvent ack) {
            return ack.devEui();
        }
        if (parsed instanceof JoinEvent join) {
            return join.devEui();
        }
        return null;
    }
}
