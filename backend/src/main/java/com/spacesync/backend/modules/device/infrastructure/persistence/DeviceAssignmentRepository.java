package com.spacesync.backend.modules.device.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.DeviceAssignment;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface DeviceAssignmentRepository extends Repository<DeviceAssignment, UUID> {

    <S extends DeviceAssignment> S save(S assignment);

    @Query("""
            select a from DeviceAssignment a
             where a.deviceId = :deviceId
               and (a.tenantId = :tenantId or :platformAdmin = true)
             order by a.occurredAt desc, a.id
            """)
    List<DeviceAssignment> findHistoryScoped(@Param("deviceId") UUID deviceId,
                                             @Param("tenantId") UUID tenantId,
                                             @Param("platformAdmin") boolean platformAdmin);

    default List<DeviceAssignment> findHistory(UUID deviceId, TenantContext context) {
        return findHistoryScoped(deviceId, context.tenantId(), context.platformAdmin());
    }
}
