package com.spacesync.backend.modules.telemetry.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.error.RetryableProblemException;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService;
import com.spacesync.backend.modules.telemetry.domain.IngestOutcome;
import com.spacesync.backend.modules.telemetry.domain.IngestResult;
import com.spacesync.backend.modules.telemetry.domain.UplinkEvent;
import com.spacesync.backend.modules.telemetry.domain.WebhookEventType;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.SpoolFullException;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.SpooledEvent;
import com.spacesync.backend.modules.telemetry.infrastructure.spool.WebhookSpool;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String SECRET = "unit-secret";
    private static final String DEV_EUI = "0102030405060708";

    @Mock
    private UplinkProcessor uplinkProcessor;

    @Mock
    private DownlinkQueueService downlinkQueueService;

    @Mock
    private WebhookSpool spool;

    private SimpleMeterRegistry meterRegistry;
    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        WebhookProperties properties = new WebhookProperties();
        properties.setSecret(SECRET);
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(OffsetDateTime.parse("2026-05-01T08:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new WebhookIngestionService(
                new WebhookSignatureVerifier(properties),
                new WebhookPayloadParser(new ObjectMapper()),
                uplinkProcessor,
                downlinkQueueService,
                spool,
                properties,
                meterRegistry,
                clock
        );
        lenient().when(spool.hasBacklog()).thenReturn(false);
    }

    @Test
    void processesUplink() {
        byte[] body = uplink(7);
        when(uplinkProcessor.processUplink(any(UplinkEvent.class), isNull(), anyString()))
                .thenReturn(new IngestResult(IngestOutcome.ACCEPTED, DEV_EUI, 7L));

        IngestResult result = service.ingest("up", body, sign(body), null);

        assertThat(result.outcome()).isEqualTo(IngestOutcome.ACCEPTED);
        assertThat(meterRegistry.counter("spacesync.webhook.uplinks", "outcome", "accepted").count()).isEqualTo(1.0);
    }

    @Test
    void rejectsBadSignature() {
        byte[] body = uplink(7);

        assertThatThrownBy(() -> service.ingest("up", body, "sha256=00", null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
        verify(uplinkProcessor, never()).processUplink(any(), any(), any());
        verify(spool, never()).hasBacklog();
    }

    @Test
    void rejectsUnknownEvent() {
        byte[] body = uplink(7);

        assertThatThrownBy(() -> service.ingest("status", body, sign(body), null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("webhook.unsupported_event"));
    }

    @Test
    void spoolsOnTransientFailure() throws Exception {
        byte[] body = uplink(8);
        when(uplinkProcessor.processUplink(any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        IngestResult result = service.ingest("up", body, sign(body), null);

        assertThat(result.outcome()).isEqualTo(IngestOutcome.SPOOLED);
        ArgumentCaptor<SpooledEvent> captor = ArgumentCaptor.forClass(SpooledEvent.class);
        verify(spool).append(captor.capture());
        assertThat(captor.getValue().event()).isEqualTo(WebhookEventType.UP);
        assertThat(captor.getValue().body()).isEqualTo(body);
    }

    @Test
    void propagatesPermanentFailure() throws Exception {
        byte[] body = uplink(8);
        when(uplinkProcessor.processUplink(any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("boom"));

        assertThatThrownBy(() -> service.ingest("up", body, sign(body), null))
                .isInstanceOf(DataIntegrityViolationException.class);
        verify(spool, never()).append(any());
    }

    @Test
    void keepsOrderBehindBacklog() throws Exception {
        byte[] body = uplink(9);
        when(spool.hasBacklog()).thenReturn(true);

        IngestResult result = service.ingest("up", body, sign(body), null);

        assertThat(result.outcome()).isEqualTo(IngestOutcome.SPOOLED);
        verify(spool).append(any());
        verify(uplinkProcessor, never()).processUplink(any(), any(), any());
    }

    @Test
    void fullSpoolIsRetryable() throws Exception {
        byte[] body = uplink(9);
        when(spool.hasBacklog()).thenReturn(true);
        doThrow(new SpoolFullException("full")).when(spool).append(any());

        assertThatThrownBy(() -> service.ingest("up", body, sign(body), null))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(60);
                });
    }

    @Test
    void confirmsDownlink() {
        byte[] body = bytes("""
                {"deviceInfo": {"devEui": "%s"}, "queueItemId": "q-9", "acknowledged": true}
                """.formatted(DEV_EUI));
        when(downlinkQueueService.confirm(eq("q-9"), eq(true))).thenReturn(Optional.empty());

        IngestResult result = service.ingest("ack", body, sign(body), null);

        assertThat(result.outcome()).isEqualTo(IngestOutcome.IGNORED);
        verify(downlinkQueueService).confirm("q-9", true);
    }

    @Test
    void replayStopsOnTransientFailure() throws Exception {
        List<Boolean> decisions = new ArrayList<>();
        when(spool.replay(any())).thenAnswer(invocation -> {
            Predicate<SpooledEvent> handler = invocation.getArgument(0);
            decisions.add(handler.test(spooled(uplink(1))));
            decisions.add(handler.test(spooled(uplink(2))));
            return 1;
        });
        when(uplinkProcessor.processUplink(any(), any(), any()))
                .thenReturn(new IngestResult(IngestOutcome.ACCEPTED, DEV_EUI, 1L))
                .thenThrow(new DataAccessResourceFailureException("down again"));

        service.replaySpool();

        assertThat(decisions).containsExactly(true, false);
    }

    @Test
    void replayDropsMalformed() throws Exception {
        List<Boolean> decisions = new ArrayList<>();
        when(spool.replay(any())).thenAnswer(invocation -> {
            Predicate<SpooledEvent> handler = invocation.getArgument(0);
            decisions.add(handler.test(spooled(bytes("{\"fCnt\": 1}"))));
            return 1;
        });

        service.replaySpool();

        assertThat(decisions).containsExactly(true);
        verify(uplinkProcessor, never()).processUplink(any(), any(), any());
    }

    private static SpooledEvent spooled(byte[] body) {
        return new SpooledEvent(WebhookEventType.UP, null, body, OffsetDateTime.parse("2026-05-01T07:59:00Z"));
    }

    private static byte[] uplink(long fcnt) {
        return bytes("""
                {"deviceInfo": {"devEui": "%s"}, "fCnt": %d, "object": {"occupied": true}}
                """.formatted(DEV_EUI, fcnt));
    }

    private static String sign(byte[] body) {
        return WebhookSignatureVerifier.signHex(body, SECRET);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
