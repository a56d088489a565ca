package com.spacesync.backend.modules.device.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.SensorDevice;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface SensorDeviceRepository extends Repository<SensorDevice, UUID> {

    <S extends SensorDevice> S save(S device);

    <S extends SensorDevice> S saveAndFlush(S device);

    @Query("""
            select d from SensorDevice d
             where d.id = :id and (d.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<SensorDevice> findScoped(@Param("id") UUID id,
                                      @Param("tenantId") UUID tenantId,
                                      @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select d from SensorDevice d
             where d.devEui = :devEui and (d.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<SensorDevice> findByDevEuiScoped(@Param("devEui") String devEui,
                                              @Param("tenantId") UUID tenantId,
                                              @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select d from SensorDevice d
             where (d.tenantId = :tenantId or :platformAdmin = true)
             order by d.devEui asc
            """)
    List<SensorDevice> findAllScoped(@Param("tenantId") UUID tenantId,
                                     @Param("platformAdmin") boolean platformAdmin);

    @Query("select count(d) > 0 from SensorDevice d where d.devEui = :devEui")
    boolean existsByDevEui(@Param("devEui") String devEui);

    /**
     * Compare-and-set on the frame counter. Returns 0 when {@code fcnt} is not strictly greater than
     * the last accepted value, i.e. the frame is a duplicate or a replay.
     */
    @Modifying
    @Query("""
            update SensorDevice d
               set d.lastFcnt = :fcnt,
                   d.lastRssi = :rssi,
                   d.lastSnr = :snr,
                   d.lastSeenAt = :now
             where d.id = :id
               and (d.lastFcnt is null or d.lastFcnt < :fcnt)
            """)
    int advanceFrameCounter(@Param("id") UUID id,
                            @Param("fcnt") long fcnt,
                            @Param("rssi") Integer rssi,
                            @Param("snr") Double snr,
                            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update SensorDevice d
               set d.lifecycleState = com.spacesync.backend.modules.device.domain.DeviceLifecycleState.OPERATIONAL,
                   d.lastSeenAt = :now
             where d.id = :id
            """)
    int markOperational(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    default Optional<SensorDevice> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }

    default Optional<SensorDevice> findByDevEui(String devEui, TenantContext context) {
        return findByDevEuiScoped(devEui, context.tenantId(), context.platformAdmin());
    }

    default List<SensorDevice> findAll(TenantContext context) {
        return findAllScoped(context.tenantId(), context.platformAdmin());
    }
}
