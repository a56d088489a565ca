package com.spacesync.backend.modules.downlink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService;
import com.spacesync.backend.modules.downlink.application.DownlinkQueueService.DispatchSummary;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;
import com.spacesync.backend.modules.downlink.domain.DownlinkStatus;
import com.spacesync.backend.modules.downlink.infrastructure.transport.DownlinkTransport;
import com.spacesync.backend.modules.downlink.infrastructure.transport.DownlinkTransportException;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.telemetry.application.WebhookIngestionService;
import com.spacesync.backend.modules.telemetry.domain.IngestOutcome;
import com.spacesync.backend.modules.telemetry.domain.IngestResult;
import com.spacesync.backend.support.AbstractPostgresIntegrationTest;
import com.spacesync.backend.support.TestTenantFactory;
import com.spacesync.backend.support.TestTenantFactory.TenantFixture;
import com.spacesync.backend.support.WebhookPayloads;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class DownlinkIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String SENSOR_EUI = "a84041000000e001";
    private static final String DISPLAY_EUI = "a84041000000e101";

    @MockBean
    private DownlinkTransport downlinkTransport;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestTenantFactory testTenantFactory;

    @Autowired
    private DownlinkQueueService downlinkQueueService;

    @Autowired
    private WebhookIngestionService webhookIngestionService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private Clock clock;

    private TenantFixture tenant;
    private Space space;
    private AbstractDevice display;

    @BeforeEach
    void setUp() {
        tenant = testTenantFactory.createTenant("metro");
        space = testTenantFactory.createSpace(tenant, "E-01");
        display = testTenantFactory.assignedDisplay(tenant, space, DISPLAY_EUI);
    }

    @Test
    void assigningDisplayQueuesCurrentColour() {
        List<DownlinkCommand> history = history();

        assertThat(history).hasSize(1);
        DownlinkCommand initial = history.get(0);
        assertThat(initial.getCommandType()).isEqualTo(DownlinkCommandType.SET_DISPLAY);
        assertThat(initial.getStatus()).isEqualTo(DownlinkStatus.QUEUED);
        assertThat(initial.getSpaceId()).isEqualTo(space.getId());
        assertThat(initial.getPayload()).containsEntry("color", "green").containsEntry("pattern", "solid");
    }

    @Test
    void newerStateSupersedesQueuedDisplayUpdate() {
        testTenantFactory.assignedSensor(tenant, space, SENSOR_EUI);
        report(1, true);

        List<DownlinkCommand> history = history();

        assertThat(history).filteredOn(command -> command.getStatus() == DownlinkStatus.QUEUED)
                .singleElement()
                .satisfies(command -> assertThat(command.getPayload()).containsEntry("color", "red"));
        assertThat(history).filteredOn(command -> command.getStatus() == DownlinkStatus.ABANDONED)
                .hasSize(2)
                .allSatisfy(command -> assertThat(command.getLastError()).isEqualTo("superseded"));
    }

    @Test
    void acknowledgedDownlinkIsDelivered() throws Exception {
        when(downlinkTransport.send(any())).thenReturn("ns-queue-1");

        DispatchSummary summary = downlinkQueueService.dispatchDue();

        assertThat(summary.sent()).isEqualTo(1);
        assertThat(history().get(0).getStatus()).isEqualTo(DownlinkStatus.SENT);
        assertThat(history().get(0).getNetworkQueueId()).isEqualTo("ns-queue-1");

        IngestResult result = ingest("ack", WebhookPayloads.ack(DISPLAY_EUI, "ns-queue-1", true));

        assertThat(result.outcome()).isEqualTo(IngestOutcome.CONFIRMED);
        DownlinkCommand delivered = history().get(0);
        assertThat(delivered.getStatus()).isEqualTo(DownlinkStatus.DELIVERED);
        assertThat(delivered.getDeliveredAt()).isNotNull();
    }

    @Test
    void unknownAcknowledgementIsIgnored() {
        IngestResult result = ingest("ack", WebhookPayloads.ack(DISPLAY_EUI, "never-sent", true));

        assertThat(result.outcome()).isEqualTo(IngestOutcome.IGNORED);
    }

    @Test
    void failingTransportExhaustsRetriesAndListsFailure() throws Exception {
        when(downlinkTransport.send(any())).thenThrow(new DownlinkTransportException("network server unavailable"));

        assertThat(downlinkQueueService.dispatchDue().retried()).isEqualTo(1);
        Thread.sleep(20);
        assertThat(downlinkQueueService.dispatchDue().retried()).isEqualTo(1);
        Thread.sleep(20);
        assertThat(downlinkQueueService.dispatchDue().failed()).isEqualTo(1);
        Thread.sleep(20);
        assertThat(downlinkQueueService.dispatchDue().total()).isZero();

        verify(downlinkTransport, times(3)).send(any());
        DownlinkCommand failed = history().get(0);
        assertThat(failed.getStatus()).isEqualTo(DownlinkStatus.FAILED);
        assertThat(failed.getAttempts()).isEqualTo(3);
        assertThat(failed.getLastError()).isEqualTo("network server unavailable");

        mockMvc.perform(get("/downlinks/failed").header("Authorization", testTenantFactory.bearer(tenant)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].devEui").value(DISPLAY_EUI));
    }

    @Test
    void claimIsCommittedBeforeTheNetworkCall() throws Exception {
        Long commandId = history().get(0).getId();
        AtomicReference<Integer> attemptsSeenBySender = new AtomicReference<>();
        when(downlinkTransport.send(any())).thenAnswer(invocation -> {
            attemptsSeenBySender.set(jdbcTemplate.queryForObject(
                    "select attempts from downlink_command where id = ? for update nowait", Integer.class, commandId));
            return "ns-queue-7";
        });

        assertThat(downlinkQueueService.dispatchDue().sent()).isEqualTo(1);

        assertThat(attemptsSeenBySender.get()).isEqualTo(1);
        assertThat(history().get(0).getStatus()).isEqualTo(DownlinkStatus.SENT);
    }

    @Test
    void unexpectedSendErrorKeepsAttemptAndDoesNotUndoOtherSends() throws Exception {
        Space other = testTenantFactory.createSpace(tenant, "E-02");
        AbstractDevice otherDisplay = testTenantFactory.assignedDisplay(tenant, other, "a84041000000e102");
        when(downlinkTransport.send(any()))
                .thenThrow(new IllegalStateException("codec bug"))
                .thenReturn("ns-queue-2");

        DispatchSummary summary = downlinkQueueService.dispatchDue();

        assertThat(summary.sent()).isEqualTo(1);
        DownlinkCommand stuck = history().get(0);
        assertThat(stuck.getStatus()).isEqualTo(DownlinkStatus.QUEUED);
        assertThat(stuck.getAttempts()).isEqualTo(1);
        assertThat(stuck.getNextAttemptAt()).isAfter(OffsetDateTime.now(clock));
        DownlinkCommand sent = downlinkQueueService.history(tenant.context(), otherDisplay.getId(), PageRequest.of(0, 50))
                .getContent().get(0);
        assertThat(sent.getStatus()).isEqualTo(DownlinkStatus.SENT);
        assertThat(sent.getAttempts()).isEqualTo(1);

        assertThat(downlinkQueueService.dispatchDue().total()).isZero();
        verify(downlinkTransport, times(2)).send(any());
    }

    @Test
    void higherPriorityCommandIsSentFirst() throws Exception {
        when(downlinkTransport.send(any())).thenReturn("ns-queue-a", "ns-queue-b");
        mockMvc.perform(post("/downlinks")
                        .header("Authorization", testTenantFactory.bearer(tenant))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"" + display.getId() + "\",\"command\":\"REBOOT\",\"priority\":1}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("QUEUED"));

        downlinkQueueService.dispatchDue();

        assertThat(history()).filteredOn(command -> command.getStatus() == DownlinkStatus.SENT)
                .singleElement()
                .satisfies(command -> assertThat(command.getCommandType()).isEqualTo(DownlinkCommandType.REBOOT));
    }

    @Test
    void invalidRawPayloadIsRejected() throws Exception {
        mockMvc.perform(post("/downlinks")
                        .header("Authorization", testTenantFactory.bearer(tenant))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"" + display.getId() + "\",\"command\":\"RAW\",\"payload\":{},\"priority\":5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("downlink.invalid_payload"));
    }

    @Test
    void clearingQueueAbandonsWaitingCommands() throws Exception {
        mockMvc.perform(post("/downlinks")
                        .header("Authorization", testTenantFactory.bearer(tenant))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"" + display.getId() + "\",\"command\":\"REBOOT\",\"priority\":5}"))
                .andExpect(status().isAccepted());

        mockMvc.perform(delete("/downlinks/queue/{deviceId}", display.getId())
                        .header("Authorization", testTenantFactory.bearer(tenant)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.abandoned").value(2));

        assertThat(history()).allSatisfy(command -> assertThat(command.getStatus()).isEqualTo(DownlinkStatus.ABANDONED));
        assertThat(downlinkQueueService.dispatchDue().total()).isZero();
    }

    private List<DownlinkCommand> history() {
        return downlinkQueueService.history(tenant.context(), display.getId(), PageRequest.of(0, 50)).getContent();
    }

    private void report(long fcnt, boolean occupied) {
        ingest("up", WebhookPayloads.uplink(SENSOR_EUI, fcnt, occupied));
    }

    private IngestResult ingest(String event, String body) {
        return webhookIngestionService.ingest(event, body.getBytes(StandardCharsets.UTF_8), WebhookPayloads.sign(body), null);
    }
}
