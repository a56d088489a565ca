package com.spacesync.backend.modules.space;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.spacesync.backend.modules.device.domain.AbstractDevice;
import com.spacesync.backend.modules.reservation.application.ReservationService;
import com.spacesync.backend.modules.reservation.application.ReservationService.CreateReservationCommand;
import com.spacesync.backend.modules.reservation.domain.Reservation;
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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SpaceDeletionIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestTenantFactory testTenantFactory;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private Clock clock;

    private TenantFixture tenant;
    private String bearer;
    private Space space;

    @BeforeEach
    void setUp() {
        tenant = testTenantFactory.createTenant("depot");
        bearer = testTenantFactory.bearer(tenant);
        space = testTenantFactory.createSpace(tenant, "D-01");
    }

    @Test
    void deletedSpaceIsTombstonedAndHidden() throws Exception {
        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNoContent());

        OffsetDateTime deletedAt = jdbcTemplate.queryForObject(
                "select deleted_at from space where id = ?", OffsetDateTime.class, space.getId());
        assertThat(deletedAt).isNotNull();

        mockMvc.perform(get("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/spaces").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNotFound());
    }

    @Test
    void deletedCodeCanBeReused() throws Exception {
        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/spaces")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"siteId\":\"" + tenant.siteId() + "\",\"code\":\"D-01\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void spaceWithActiveReservationCannotBeDeleted() throws Exception {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Reservation booking = reservationService.create(tenant.context(), new CreateReservationCommand(space.getId(),
                now.plusHours(2), now.plusHours(3), "req-del", null, null, null)).reservation();

        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("space.active_reservations"))
                .andExpect(jsonPath("$.properties.activeReservations").value(1));

        reservationService.cancel(tenant.context(), booking.getId(), "plans changed");

        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNoContent());
    }

    @Test
    void spaceWithAssignedDeviceCannotBeDeleted() throws Exception {
        AbstractDevice sensor = testTenantFactory.assignedSensor(tenant, space, "a84041000000e001");

        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("space.devices_assigned"));

        mockMvc.perform(delete("/devices/sensors/{id}/assignment", sensor.getId())
                        .param("reason", "decommissioned")
                        .header("Authorization", bearer))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", bearer))
                .andExpect(status().isNoContent());
    }

    @Test
    void otherTenantCannotDeleteSpace() throws Exception {
        TenantFixture other = testTenantFactory.createTenant("rival");

        mockMvc.perform(delete("/spaces/{id}", space.getId()).header("Authorization", testTenantFactory.bearer(other)))
                .andExpect(status().isNotFound());

        Integer remaining = jdbcTemplate.queryForObject(
                "select count(*) from space where id = ? and deleted_at is null", Integer.class, space.getId());
        assertThat(remaining).isEqualTo(1);
    }
}
