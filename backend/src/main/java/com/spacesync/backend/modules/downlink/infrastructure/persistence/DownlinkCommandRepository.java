package com.spacesync.backend.modules.downlink.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface DownlinkCommandRepository extends Repository<DownlinkCommand, Long> {

    <S extends DownlinkCommand> S save(S command);

    <S extends DownlinkCommand> S saveAndFlush(S command);

    /**
     * Locks the head command of every device whose head is due. Only a device's head is eligible,
     * so a command waiting out its backoff holds back the lower-priority commands behind it.
     * Rows locked by a concurrent dispatcher are skipped.
     */
    @Query(value = """
            select c.* from downlink_command c
             where c.id in (
                   select distinct on (q.device_id) q.id
                     from downlink_command q
                    where q.status = 'QUEUED'
                    order by q.device_id, q.priority, q.id)
               and c.next_attempt_at <= :now
             order by c.priority, c.id
             limit :limit
             for update skip locked
            """, nativeQuery = true)
    List<DownlinkCommand> lockDispatchable(@Param("now") OffsetDateTime now, @Param("limit") int limit);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from DownlinkCommand c where c.id = :id")
    Optional<DownlinkCommand> lockById(@Param("id") Long id);

    @Query("select c from DownlinkCommand c where c.networkQueueId = :networkQueueId")
    Optional<DownlinkCommand> findByNetworkQueueId(@Param("networkQueueId") String networkQueueId);

    @Query("""
            select c from DownlinkCommand c
             where c.deviceId = :deviceId
               and (c.tenantId = :tenantId or :platformAdmin = true)
             order by c.id desc
            """)
    Page<DownlinkCommand> findHistoryScoped(@Param("deviceId") UUID deviceId,
                                            @Param("tenantId") UUID tenantId,
                                            @Param("platformAdmin") boolean platformAdmin,
                                            Pageable pageable);

    @Query("""
            select c from DownlinkCommand c
             where c.status = com.spacesync.backend.modules.downlink.domain.DownlinkStatus.FAILED
               and (c.tenantId = :tenantId or :platformAdmin = true)
             order by c.closedAt desc, c.id desc
            """)
    Page<DownlinkCommand> findFailedScoped(@Param("tenantId") UUID tenantId,
                                           @Param("platformAdmin") boolean platformAdmin,
                                           Pageable pageable);

    @Query("""
            select c from DownlinkCommand c
             where c.deviceId = :deviceId
               and c.status = com.spacesync.backend.modules.downlink.domain.DownlinkStatus.QUEUED
               and (c.tenantId = :tenantId or :platformAdmin = true)
             order by c.priority asc, c.id asc
            """)
    List<DownlinkCommand> findQueuedScoped(@Param("deviceId") UUID deviceId,
                                           @Param("tenantId") UUID tenantId,
                                           @Param("platformAdmin") boolean platformAdmin);

    @Modifying(clearAutomatically = true)
    @Query("""
            update DownlinkCommand c
               set c.status = com.spacesync.backend.modules.downlink.domain.DownlinkStatus.ABANDONED,
                   c.lastError = :reason,
                   c.closedAt = :now,
                   c.updatedAt = :now
             where c.deviceId = :deviceId
               and c.status = com.spacesync.backend.modules.downlink.domain.DownlinkStatus.QUEUED
               and (:commandType is null or c.commandType = :commandType)
               and (c.tenantId = :tenantId or :platformAdmin = true)
            """)
    int abandonQueuedScoped(@Param("deviceId") UUID deviceId,
                            @Param("commandType") DownlinkCommandType commandType,
                            @Param("reason") String reason,
                            @Param("now") OffsetDateTime now,
                            @Param("tenantId") UUID tenantId,
                            @Param("platformAdmin") boolean platformAdmin);

    default Page<DownlinkCommand> findHistory(UUID deviceId, TenantContext context, Pageable pageable) {
        return findHistoryScoped(deviceId, context.tenantId(), context.platformAdmin(), pageable);
    }

    default Page<DownlinkCommand> findFailed(TenantContext context, Pageable pageable) {
        return findFailedScoped(context.tenantId(), context.platformAdmin(), pageable);
    }

    default List<DownlinkCommand> findQueued(UUID deviceId, TenantContext context) {
        return findQueuedScoped(deviceId, context.tenantId(), context.platformAdmin());
    }
}
