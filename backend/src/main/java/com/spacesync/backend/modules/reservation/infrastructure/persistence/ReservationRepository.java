package com.spacesync.backend.modules.reservation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.reservation.domain.Reservation;
import com.spacesync.backend.modules.reservation.domain.ReservationStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface ReservationRepository extends Repository<Reservation, UUID> {

    <S extends Reservation> S save(S reservation);

    <S extends Reservation> S saveAndFlush(S reservation);

    @Query("""
            select r from Reservation r
             where r.id = :id and (r.tenantId = :tenantId or :platformAdmin = true)
            """)
    Optional<Reservation> findScoped(@Param("id") UUID id,
                                     @Param("tenantId") UUID tenantId,
                                     @Param("platformAdmin") boolean platformAdmin);

    /**
     * Idempotency keys are unique per tenant, so this lookup is by the owning tenant only.
     */
    @Query("select r from Reservation r where r.tenantId = :tenantId and r.requestId = :requestId")
    Optional<Reservation> findByRequestId(@Param("tenantId") UUID tenantId, @Param("requestId") String requestId);

    @Query("""
            select r from Reservation r
             where r.spaceId = :spaceId
               and r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and r.startTime < :end
               and r.endTime > :start
               and (r.tenantId = :tenantId or :platformAdmin = true)
             order by r.startTime asc
            """)
    List<Reservation> findActiveOverlappingScoped(@Param("spaceId") UUID spaceId,
                                                  @Param("start") OffsetDateTime start,
                                                  @Param("end") OffsetDateTime end,
                                                  @Param("tenantId") UUID tenantId,
                                                  @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select count(r) > 0 from Reservation r
             where r.spaceId = :spaceId
               and r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and r.startTime <= :at
               and r.endTime > :at
               and (r.tenantId = :tenantId or :platformAdmin = true)
            """)
    boolean existsActiveAtScoped(@Param("spaceId") UUID spaceId,
                                 @Param("at") OffsetDateTime at,
                                 @Param("tenantId") UUID tenantId,
                                 @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select count(r) from Reservation r
             where r.spaceId = :spaceId
               and r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and (r.tenantId = :tenantId or :platformAdmin = true)
            """)
    long countActiveScoped(@Param("spaceId") UUID spaceId,
                           @Param("tenantId") UUID tenantId,
                           @Param("platformAdmin") boolean platformAdmin);

    @Query("""
            select r from Reservation r
             where (r.tenantId = :tenantId or :platformAdmin = true)
               and (:spaceId is null or r.spaceId = :spaceId)
               and (:status is null or r.status = :status)
               and r.endTime > :from
               and r.startTime < :to
             order by r.startTime asc, r.id asc
            """)
    Page<Reservation> searchScoped(@Param("spaceId") UUID spaceId,
                                   @Param("status") ReservationStatus status,
                                   @Param("from") OffsetDateTime from,
                                   @Param("to") OffsetDateTime to,
                                   @Param("tenantId") UUID tenantId,
                                   @Param("platformAdmin") boolean platformAdmin,
                                   Pageable pageable);

    @Query("""
            select r from Reservation r
             where r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and r.endTime <= :now
               and (r.tenantId = :tenantId or :platformAdmin = true)
             order by r.endTime asc
            """)
    List<Reservation> findOverdueScoped(@Param("now") OffsetDateTime now,
                                        @Param("tenantId") UUID tenantId,
                                        @Param("platformAdmin") boolean platformAdmin,
                                        Pageable pageable);

    /**
     * Spaces whose booking window is open but which do not show {@code RESERVED} yet.
     */
    @Query("""
            select distinct r.spaceId from Reservation r, Space s
             where s.id = r.spaceId
               and r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and r.startTime <= :now
               and r.endTime > :now
               and s.currentState <> com.spacesync.backend.modules.space.domain.SpaceState.RESERVED
               and s.currentState <> com.spacesync.backend.modules.space.domain.SpaceState.MAINTENANCE
               and (r.tenantId = :tenantId or :platformAdmin = true)
            """)
    List<UUID> findSpacesWithOpenedWindowScoped(@Param("now") OffsetDateTime now,
                                                @Param("tenantId") UUID tenantId,
                                                @Param("platformAdmin") boolean platformAdmin);

    /**
     * Conditional terminal transition. Matches nothing once the row has left {@code ACTIVE}, which
     * makes a repeated sweep a no-op.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            update Reservation r
               set r.status = case when r.checkedInAt is not null
                                   then com.spacesync.backend.modules.reservation.domain.ReservationStatus.COMPLETED
                                   else :uncheckedStatus end,
                   r.closedAt = :now,
                   r.updatedAt = :now,
                   r.version = r.version + 1
             where r.id = :id
               and r.status = com.spacesync.backend.modules.reservation.domain.ReservationStatus.ACTIVE
               and r.endTime <= :now
            """)
    int closeIfOverdue(@Param("id") UUID id,
                       @Param("uncheckedStatus") ReservationStatus uncheckedStatus,
                       @Param("now") OffsetDateTime now);

    default Optional<Reservation> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }

    default List<Reservation> findActiveOverlapping(UUID spaceId, OffsetDateTime start, OffsetDateTime end,
                                                    TenantContext context) {
        return findActiveOverlappingScoped(spaceId, start, end, context.tenantId(), context.platformAdmin());
    }

    default long countActive(UUID spaceId, TenantContext context) {
        return countActiveScoped(spaceId, context.tenantId(), context.platformAdmin());
    }

    default boolean existsActiveAt(UUID spaceId, OffsetDateTime at, TenantContext context) {
        return existsActiveAtScoped(spaceId, at, context.tenantId(), context.platformAdmin());
    }

    default Page<Reservation> search(UUID spaceId, ReservationStatus status, OffsetDateTime from, OffsetDateTime to,
                                     TenantContext context, Pageable pageable) {
        return searchScoped(spaceId, status, from, to, context.tenantId(), context.platformAdmin(), pageable);
    }

    default List<Reservation> findOverdue(OffsetDateTime now, TenantContext context, Pageable pageable) {
        return findOverdueScoped(now, context.tenantId(), context.platformAdmin(), pageable);
    }

    default List<UUID> findSpacesWithOpenedWindow(OffsetDateTime now, TenantContext context) {
        return findSpacesWithOpenedWindowScoped(now, context.tenantId(), context.platformAdmin());
    }
}
