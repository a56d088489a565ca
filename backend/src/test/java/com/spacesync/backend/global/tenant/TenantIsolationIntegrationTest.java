package com.spacesync.backend.global.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.reservation.application.ReservationService;
import com.spacesync.backend.modules.reservation.application.ReservationService.CreateReservationCommand;
import com.spacesync.backend.modules.reservation.domain.Reservation;
import com.spacesync.backend.modules.reservation.domain.ReservationStatus;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.support.AbstractPostgresIntegrationTest;
import com.spacesync.backend.support.TestTenantFactory;
import com.spacesync.backend.support.TestTenantFactory.TenantFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class TenantIsolationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestTenantFactory testTenantFactory;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private Clock clock;

    private TenantFixture alpha;
    private TenantFixture beta;
    private Space alphaSpace;
    private Reservation alphaReservation;
    private AbstractDevice alphaDisplay;

    @BeforeEach
    void setUp() {
        alpha = testTenantFactory.createTenant("alpha");
        beta = testTenantFactory.createTenant("beta");
        alphaSpace = testTenantFactory.createSpace(alpha, "A-1");
        testTenantFactory.createSpace(beta, "B-1");
        alphaDisplay = testTenantFactory.assignedDisplay(alpha, alphaSpace, "a84041000000f001");
        OffsetDateTime start = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.HOURS).plusDays(2);
        alphaReservation = reservationService.create(alpha.context(), new CreateReservationCommand(
                alphaSpace.getId(), start, start.plusHours(1), "alpha-1", "a@example.com", "Alpha", null)).reservation();
    }

    @Test
    void otherTenantCannotSeeSpaceOrReservation() throws Exception {
        mockMvc.perform(get("/spaces/{id}", alphaSpace.getId()).header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/reservations/{id}", alphaReservation.getId())
                        .header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/spaces/{id}/state-changes", alphaSpace.getId())
                        .header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isNotFound());
    }

    @Test
    void otherTenantCannotCancelOrBook() throws Exception {
        mockMvc.perform(post("/reservations/{id}/cancel", alphaReservation.getId())
                        .header("Authorization", testTenantFactory.bearer(beta))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"mine now\"}"))
                .andExpect(status().isNotFound());

        OffsetDateTime start = alphaReservation.getEndTime();
        mockMvc.perform(post("/reservations")
                        .header("Authorization", testTenantFactory.bearer(beta))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"spaceId": "%s", "startTime": "%s", "endTime": "%s", "requestId": "beta-1"}
                                """.formatted(alphaSpace.getId(), start, start.plusHours(1))))
                .andExpect(status().isNotFound());

        assertThat(reservationService.get(alpha.context(), alphaReservation.getId()).getStatus())
                .isEqualTo(ReservationStatus.ACTIVE);
    }

    @Test
    void otherTenantCannotTouchDevicesOrOverride() throws Exception {
        mockMvc.perform(get("/devices/displays/{id}", alphaDisplay.getId())
                        .header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isNotFound());
        mockMvc.perform(put("/spaces/{id}/override", alphaSpace.getId())
                        .header("Authorization", testTenantFactory.bearer(beta))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\":true,\"reason\":\"hijack\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/downlinks")
                        .header("Authorization", testTenantFactory.bearer(beta))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"" + alphaDisplay.getId() + "\",\"command\":\"REBOOT\",\"priority\":1}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listingsAreScopedToCallerTenant() throws Exception {
        mockMvc.perform(get("/spaces").header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].code").value("B-1"));
        mockMvc.perform(get("/reservations").header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));
        mockMvc.perform(get("/devices").param("kind", "DISPLAY").header("Authorization", testTenantFactory.bearer(beta)))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void platformAdminSeesEveryTenant() throws Exception {
        mockMvc.perform(get("/spaces").header("Authorization", testTenantFactory.platformAdminBearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        mockMvc.perform(get("/reservations/{id}", alphaReservation.getId())
                        .header("Authorization", testTenantFactory.platformAdminBearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value(alpha.tenantId().toString()));
    }

    @Test
    void tenantHeaderSwitchIsForbiddenForOperators() throws Exception {
        mockMvc.perform(get("/spaces")
                        .header("Authorization", testTenantFactory.bearer(beta))
                        .header("X-Tenant-Id", alpha.tenantId().toString()))
                .andExpect(status().isForbidden());
    }

    @Test
    void unauthenticatedRequestIsRejected() throws Exception {
        mockMvc.perform(get("/spaces"))
                .andExpect(status().isUnauthorized());
    }
}
