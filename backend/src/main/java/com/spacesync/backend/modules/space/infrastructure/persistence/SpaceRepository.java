package com.spacesync.backend.modules.space.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.space.domain.Space;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Every finder takes the caller's tenant and the platform-admin flag; there is no unscoped read.
 */
public interface SpaceRepository extends Repository<Space, UUID> {

    <S extends Space> S save(S space);

    <S extends Space> S saveAndFlush(S space);

    @Query("""
            select s from Space s
             where s.id = :id
               and s.deletedAt is null
               and (s.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<Space> findScoped(@Param("id") UUID id,
                               @Param("tenantId") UUID tenantId,
                               @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select s from Space s
             where s.deletedAt is null
               and (s.tenantId = :tenantId or :platformAdmin = true)
               and (:siteId is null or s.siteId = :siteId)
             order by s.code asc
            """)
    List<Space> findAllScoped(@Param("siteId") UUID siteId,
                              @Param("tenantId") UUID tenantId,
                              @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select count(s) > 0 from Space s
             where s.tenantId = :tenantId and s.siteId = :siteId and s.code = :code and s.deletedAt is null
            """)
    boolean existsByCode(@Param("tenantId") UUID tenantId,
                         @Param("siteId") UUID siteId,
                         @Param("code") String code);

    /**
     * Spaces whose occupied sensor reading is older than their auto-release window and that hold
     * no active reservation right now.
     */
    @Query(value = """
            select s.id from space s
             where s.deleted_at is null
               and s.sensor_state = 'OCCUPIED'
               and s.auto_release_minutes is not null
               and s.sensor_state_changed_at + make_interval(mins => s.auto_release_minutes) <= :now
               and (s.tenant_id = :tenantId or :platformAdmin = true)
               and not exists (
                     select 1 from reservation r
                      where r.space_id = s.id
                        and r.status = 'ACTIVE'
                        and r.start_time <= :now
                        and r.end_time > :now)
            """, nativeQuery = true)
    List<UUID> findAutoReleaseCandidates(@Param("now") OffsetDateTime now,
                                         @Param("tenantId") UUID tenantId,
                                         @Param("platformAdmin") boolean platformAdmin);

    default Optional<Space> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }

    default List<Space> findAll(UUID siteId, TenantContext context) {
        return findAllScoped(siteId, context.tenantId(), context.platformAdmin());
    }

    default List<UUID> findAutoReleaseCandidates(OffsetDateTime now, TenantContext context) {
        return findAutoReleaseCandidates(now, context.tenantId(), context.platformAdmin());
    }
}
