package com.spacesync.backend.modules.telemetry.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.telemetry.domain.SensorReading;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface SensorReadingRepository extends Repository<SensorReading, Long> {

    SensorReading save(SensorReading reading);

    @Query("""
            select r from SensorReading r
             where r.deviceId = :deviceId and (r.tenantId = :tenantId or :platformAdmin = true)
             order by r.fcnt desc
            """)
    List<SensorReading> findLatestScoped(@Param("deviceId") UUID deviceId,
                                         @Param("tenantId") UUID tenantId,
                                         @Param("platformAdmin") boolean platformAdmin,
                                         Pageable pageable);

    /**
     * Deletes up to {@code limit} readings received before {@code cutoff}, oldest first.
     */
    @Modifying
    @Query(value = """
            delete from sensor_reading
             where id in (
                   select id from sensor_reading
                    where received_at < :cutoff
                    order by received_at
                    limit :limit)
            """, nativeQuery = true)
    int deleteReceivedBefore(@Param("cutoff") OffsetDateTime cutoff, @Param("limit") int limit);

    default List<SensorReading> findLatest(UUID deviceId, TenantContext context, Pageable pageable) {
        return findLatestScoped(deviceId, context.tenantId(), context.platformAdmin(), pageable);
    }
}
