package com.spacesync.backend.modules.device;

import static com.spacesync.backend.support.ConcurrentCalls.runAll;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.modules.device.application.DeviceAssignmentService;
import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.device.domain.DeviceAssignment;
import com.spacesync.backend.modules.device.domain.DeviceKind;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.SpaceState;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;
import com.spacesync.backend.modules.telemetry.application.WebhookIngestionService;
import com.spacesync.backend.support.AbstractPostgresIntegrationTest;
import com.spacesync.backend.support.TestTenantFactory;
import com.spacesync.backend.support.TestTenantFactory.TenantFixture;
import com.spacesync.backend.support.WebhookPayloads;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class DeviceAssignmentIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestTenantFactory testTenantFactory;

    @Autowired
    private SpaceRepository spaceRepository;

    @Autowired
    private WebhookIngestionService webhookIngestionService;

    @Autowired
    private DeviceAssignmentService deviceAssignmentService;

    private TenantFixture tenant;
    private String bearer;
    private Space first;
    private Space second;

    @BeforeEach
    void setUp() {
        tenant = testTenantFactory.createTenant("garage");
        bearer = testTenantFactory.bearer(tenant);
        first = testTenantFactory.createSpace(tenant, "G-01");
        second = testTenantFactory.createSpace(tenant, "G-02");
    }

    @Test
    void registerNormalizesDevEuiAndRejectsDuplicates() throws Exception {
        register("SENSOR", "A8:40:41:00:00:00:D0:01")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.devEui").value("a84041000000d001"))
                .andExpect(jsonPath("$.lifecycleState").value("PROVISIONED"));

        register("DISPLAY", "a84041000000d001")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("device.eui_taken"));

        register("SENSOR", "not-a-eui")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("device.invalid_dev_eui"));
    }

    @Test
    void sensorCannotServeTwoSpaces() throws Exception {
        AbstractDevice sensor = testTenantFactory.assignedSensor(tenant, first, "a84041000000d002");

        assign("sensors", sensor, second)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("device.already_assigned"));
    }

    @Test
    void concurrentAssignmentsOfOneSensorLetExactlyOneWin() throws Exception {
        AbstractDevice sensor = testTenantFactory.registerSensor(tenant, "a84041000000d00a");
        List<Callable<Object>> attempts = List.of(
                () -> deviceAssignmentService.assign(tenant.context(), DeviceKind.SENSOR, sensor.getId(), first.getId(), null),
                () -> deviceAssignmentService.assign(tenant.context(), DeviceKind.SENSOR, sensor.getId(), second.getId(), null));

        List<Object> outcomes = runAll(attempts);

        assertThat(outcomes).filteredOn(DeviceAssignment.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(ProblemException.class::isInstance)
                .singleElement()
                .satisfies(failure -> {
                    ProblemException problem = (ProblemException) failure;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(problem.getCode()).isIn("device.already_assigned", "device.assignment_conflict");
                });
        UUID winner = ((DeviceAssignment) outcomes.stream()
                .filter(DeviceAssignment.class::isInstance).findFirst().orElseThrow()).getSpaceId();
        UUID loser = winner.equals(first.getId()) ? second.getId() : first.getId();
        assertThat(spaceRepository.findById(winner, tenant.context()).orElseThrow().getSensorDeviceId())
                .isEqualTo(sensor.getId());
        assertThat(spaceRepository.findById(loser, tenant.context()).orElseThrow().getSensorDeviceId()).isNull();
        mockMvc.perform(get("/devices/sensors/{id}/assignments", sensor.getId()).header("Authorization", bearer))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void concurrentAssignmentsToOneSlotLetExactlyOneWin() throws Exception {
        AbstractDevice a = testTenantFactory.registerSensor(tenant, "a84041000000d00b");
        AbstractDevice b = testTenantFactory.registerSensor(tenant, "a84041000000d00c");
        List<Callable<Object>> attempts = List.of(
                () -> deviceAssignmentService.assign(tenant.context(), DeviceKind.SENSOR, a.getId(), first.getId(), null),
                () -> deviceAssignmentService.assign(tenant.context(), DeviceKind.SENSOR, b.getId(), first.getId(), null));

        List<Object> outcomes = runAll(attempts);

        assertThat(outcomes).filteredOn(DeviceAssignment.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(ProblemException.class::isInstance)
                .singleElement()
                .satisfies(failure -> assertThat(((ProblemException) failure).getCode())
                        .isIn("space.device_slot_taken", "device.assignment_conflict"));
    }

    @Test
    void spaceCannotHoldTwoSensors() throws Exception {
        testTenantFactory.assignedSensor(tenant, first, "a84041000000d003");
        AbstractDevice spare = testTenantFactory.registerSensor(tenant, "a84041000000d004");

        assign("sensors", spare, first)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("space.device_slot_taken"));
    }

    @Test
    void spaceHoldsOneSensorAndOneDisplay() throws Exception {
        testTenantFactory.assignedSensor(tenant, first, "a84041000000d005");
        AbstractDevice display = testTenantFactory.registerDisplay(tenant, "a84041000000d006");

        assign("displays", display, first)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("ASSIGNED"))
                .andExpect(jsonPath("$.deviceKind").value("DISPLAY"));

        mockMvc.perform(get("/spaces/{id}", first.getId()).header("Authorization", bearer))
                .andExpect(jsonPath("$.displayDeviceId").value(display.getId().toString()));
    }

    @Test
    void unassigningSensorClearsItsReadingAndKeepsHistory() throws Exception {
        AbstractDevice sensor = testTenantFactory.assignedSensor(tenant, first, "a84041000000d007");
        String body = WebhookPayloads.uplink("a84041000000d007", 1, true);
        webhookIngestionService.ingest("up", body.getBytes(StandardCharsets.UTF_8), WebhookPayloads.sign(body), null);
        assertThat(state(first)).isEqualTo(SpaceState.OCCUPIED);

        mockMvc.perform(delete("/devices/sensors/{id}/assignment", sensor.getId())
                        .param("reason", "battery swap")
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("UNASSIGNED"))
                .andExpect(jsonPath("$.reason").value("battery swap"));

        assertThat(state(first)).isEqualTo(SpaceState.FREE);
        assertThat(spaceRepository.findById(first.getId(), tenant.context()).orElseThrow().getSensorState()).isNull();

        assign("sensors", sensor, second).andExpect(status().isOk());
        assertThat(state(second)).isEqualTo(SpaceState.UNKNOWN);

        mockMvc.perform(get("/devices/sensors/{id}/assignments", sensor.getId()).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
        mockMvc.perform(get("/devices/sensors/{id}", sensor.getId()).header("Authorization", bearer))
                .andExpect(jsonPath("$.assignedSpaceId").value(second.getId().toString()));
    }

    @Test
    void unassigningFreeDeviceIsConflict() throws Exception {
        AbstractDevice sensor = testTenantFactory.registerSensor(tenant, "a84041000000d008");

        mockMvc.perform(delete("/devices/sensors/{id}/assignment", sensor.getId()).header("Authorization", bearer))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("device.not_assigned"));
    }

    @Test
    void registeringOrphanRemovesItFromOrphanList() throws Exception {
        String eui = "a84041000000d009";
        String body = WebhookPayloads.uplink(eui, 1, true);
        webhookIngestionService.ingest("up", body.getBytes(StandardCharsets.UTF_8), WebhookPayloads.sign(body), null);
        mockMvc.perform(get("/devices/orphans").header("Authorization", testTenantFactory.platformAdminBearer()))
                .andExpect(jsonPath("$.totalElements").value(1));

        register("SENSOR", eui).andExpect(status().isCreated());

        mockMvc.perform(get("/devices/orphans").header("Authorization", testTenantFactory.platformAdminBearer()))
                .andExpect(jsonPath("$.totalElements").value(0));
    }

    private ResultActions register(String kind, String devEui) throws Exception {
        return mockMvc.perform(post("/devices")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"" + kind + "\",\"devEui\":\"" + devEui + "\",\"name\":\"bay sensor\"}"));
    }

    private ResultActions assign(String kind, AbstractDevice device, Space space) throws Exception {
        return mockMvc.perform(put("/devices/{kind}/{id}/assignment", kind, device.getId())
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spaceId\":\"" + space.getId() + "\",\"reason\":\"install\"}"));
    }

    private SpaceState state(Space space) {
        return spaceRepository.findById(space.getId(), tenant.context()).orElseThrow().getCurrentState();
    }
}
