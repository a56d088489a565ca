package com.spacesync.backend.modules.space.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.space.domain.StateChange;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Append-only: exposes inserts and reads, never updates or deletes.
 */
public interface StateChangeRepository extends Repository<StateChange, Long> {

    <S extends StateChange> S save(S change);

    @Query("""
            select c from StateChange c
             where c.spaceId = :spaceId
               and (c.tenantId = :tenantId or :platformAdmin = true)
               and c.changedAt >= :from
               and c.changedAt < :to
             order by c.changedAt desc, c.id desc
            """)
    Page<StateChange> findForSpace(@Param("spaceId") UUID spaceId,
                                   @Param("from") OffsetDateTime from,
                                   @Param("to") OffsetDateTime to,
                                   @Param("tenantId") UUID tenantId,
                                   @Param("platformAdmin") boolean platformAdmin,
                                   Pageable pageable);

    @Query("""
            select c from StateChange c
             where c.spaceId = :spaceId
               and (c.tenantId = :tenantId or :platformAdmin = true)
             order by c.id asc
            """)
    List<StateChange> findAllForSpace(@Param("spaceId") UUID spaceId,
                                      @Param("tenantId") UUID tenantId,
                                      @Param("platformAdmin") boolean platformAdmin);

    default Page<StateChange> findForSpace(UUID spaceId, OffsetDateTime from, OffsetDateTime to,
                                           TenantContext context, Pageable pageable) {
        return findForSpace(spaceId, from, to, context.tenantId(), context.platformAdmin(), pageable);
    }

    default List<StateChange> findAllForSpace(UUID spaceId, TenantContext context) {
        return findAllForSpace(spaceId, context.tenantId(), context.platformAdmin());
    }
}
