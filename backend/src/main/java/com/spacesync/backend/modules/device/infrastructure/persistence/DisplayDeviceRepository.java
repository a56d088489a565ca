package com.spacesync.backend.modules.device.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.DisplayDevice;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface DisplayDeviceRepository extends Repository<DisplayDevice, UUID> {

    <S extends DisplayDevice> S save(S device);

    <S extends DisplayDevice> S saveAndFlush(S device);

    @Query("""
            select d from DisplayDevice d
             where d.id = :id and (d.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<DisplayDevice> findScoped(@Param("id") UUID id,
                                       @Param("tenantId") UUID tenantId,
                                       @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select d from DisplayDevice d
             where d.devEui = :devEui and (d.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<DisplayDevice> findByDevEuiScoped(@Param("devEui") String devEui,
                                               @Param("tenantId") UUID tenantId,
                                               @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select d from DisplayDevice d
             where (d.tenantId = :tenantId or :platformAdmin = true)
             order by d.devEui asc
            """)
    List<DisplayDevice> findAllScoped(@Param("tenantId") UUID tenantId,
                                      @Param("platformAdmin") boolean platformAdmin);

    @Query("select count(d) > 0 from DisplayDevice d where d.devEui = :devEui")
    boolean existsByDevEui(@Param("devEui") String devEui);

    @Modifying
    @Query("""
            update DisplayDevice d
               set d.lifecycleState = com.spacesync.backend.modules.device.domain.DeviceLifecycleState.OPERATIONAL,
                   d.lastSeenAt = :now
             where d.id = :id
            """)
    int markSeen(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    default Optional<DisplayDevice> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }

    default Optional<DisplayDevice> findByDevEui(String devEui, TenantContext context) {
        return findByDevEuiScoped(devEui, context.tenantId(), context.platformAdmin());
    }

    default List<DisplayDevice> findAll(TenantContext context) {
        return findAllScoped(context.tenantId(), context.platformAdmin());
    }
}
