package com.spacesync.backend.modules.reservation.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.reservation.domain.Reservation;
import com.spacesync.backend.modules.reservation.domain.Reservation.Requester;
import com.spacesync.backend.modules.reservation.domain.ReservationStatus;
import com.spacesync.backend.modules.reservation.infrastructure.persistence.ReservationRepository;
import com.spacesync.backend.modules.space.application.SpaceStateService;
import com.spacesync.backend.modules.space.domain.Space;
import com.spacesync.backend.modules.space.domain.SpaceState;
import com.spacesync.backend.modules.space.domain.StateChangeSource;
import com.spacesync.backend.modules.space.infrastructure.persistence.SpaceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Booking engine. Idempotency and overlap exclusion are enforced by the schema
 * ({@code uq_reservation_tenant_request}, {@code ex_reservation_no_overlap}); this service only
 * translates the violations. Every status change is followed by a recompute of the space.
 */
@Service
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    static final String UNIQUE_REQUEST_CONSTRAINT = "uq_reservation_tenant_request";
    static final String OVERLAP_CONSTRAINT = "ex_reservation_no_overlap";
    private static final int MAX_REQUEST_ID_LENGTH = 128;

    private final ReservationRepository reservationRepository;
    private final SpaceRepository spaceRepository;
    private final SpaceStateService spaceStateService;
    private final TransactionTemplate requiresNewTransaction;
    private final Clock clock;
    private final Duration maxDuration;
    private final boolean requireCheckIn;
    private final int sweepBatchSize;

    public ReservationService(
            ReservationRepository reservationRepository,
            SpaceRepository spaceRepository,
            SpaceStateService spaceStateService,
            @Qualifier("requiresNewTransactionTemplate") TransactionTemplate requiresNewTransaction,
            Clock clock,
            @Value("${app.reservation.max-duration:PT24H}") Duration maxDuration,
            @Value("${app.reservation.require-check-in:false}") boolean requireCheckIn,
            @Value("${app.reservation.sweep-batch-size:500}") int sweepBatchSize
    ) {
        this.reservationRepository = reservationRepository;
        this.spaceRepository = spaceRepository;
        this.spaceStateService = spaceStateService;
        this.requiresNewTransaction = requiresNewTransaction;
        this.clock = clock;
        this.maxDuration = maxDuration;
        this.requireCheckIn = requireCheckIn;
        this.sweepBatchSize = sweepBatchSize;
    }

    /**
     * Books a space. Replaying a {@code requestId} the tenant already used returns the original
     * booking unchanged, whatever the rest of the command says.
     */
    public CreateReservationResult create(TenantContext context, CreateReservationCommand command) {
        String requestId = validateRequestId(command.requestId());
        OffsetDateTime now = OffsetDateTime.now(clock);
        validateWindow(command.startTime(), command.endTime(), now);

        Space space = requiresNewTransaction.execute(status -> spaceRepository.findById(command.spaceId(), context)
                .orElseThrow(() -> ProblemException.notFound("space.not_found", "Space not found: " + command.spaceId())));
        TenantContext owner = context.actingFor(space.getTenantId());

        Optional<Reservation> replay = findByRequestId(owner, requestId);
        if (replay.isPresent()) {
            return new CreateReservationResult(replay.get(), false);
        }

        Reservation created;
        try {
            created = requiresNewTransaction.execute(status -> reservationRepository.saveAndFlush(Reservation.book(
                    owner.tenantId(),
                    space.getId(),
                    requestId,
                    command.startTime(),
                    command.endTime(),
                    new Requester(context.actorId(), command.requesterEmail(), command.requesterName()),
                    command.notes(),
                    now
            )));
        } catch (DataIntegrityViolationException ex) {
            Optional<Reservation> original = findByRequestId(owner, requestId);
            if (original.isPresent()) {
                log.debug("Reservation request {} replayed concurrently, returning {}", requestId, original.get().getId());
                return new CreateReservationResult(original.get(), false);
            }
            throw translateInsertViolation(ex, owner, command);
        } catch (PessimisticLockingFailureException ex) {
            // concurrent inserts on the exclusion constraint can deadlock; postgres aborts one of them
            Optional<Reservation> original = findByRequestId(owner, requestId);
            if (original.isPresent()) {
                return new CreateReservationResult(original.get(), false);
            }
            throw overlapConflict(owner, command);
        }

        log.info("Reservation {} created on space {} [{} - {})", created.getId(), space.getId(),
                created.getStartTime(), created.getEndTime());
        recomputeQuietly(owner, space.getId(), requestId);
        return new CreateReservationResult(created, true);
    }

    public Reservation cancel(TenantContext context, UUID reservationId, String reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Reservation cancelled = runStatusChange(context, reservationId, reservation -> {
            reservation.cancel(context.actorId(), StringUtils.hasText(reason) ? reason.trim() : null, now);
        });
        log.info("Reservation {} cancelled by {}", reservationId, context.actorId());
        recomputeQuietly(context.actingFor(cancelled.getTenantId()), cancelled.getSpaceId(), null);
        return cancelled;
    }

    public Reservation checkIn(TenantContext context, UUID reservationId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return runStatusChange(context, reservationId, reservation -> {
            if (!reservation.isWindowOpenAt(now)) {
                throw ProblemException.conflict("reservation.outside_window",
                        "Check-in is only possible between start and end of the reservation");
            }
            reservation.checkIn(now);
        });
    }

    @Transactional(readOnly = true)
    public Reservation get(TenantContext context, UUID reservationId) {
        return reservationRepository.findById(reservationId, context)
                .orElseThrow(() -> notFound(reservationId));
    }

    @Transactional(readOnly = true)
    public Page<Reservation> list(TenantContext context, ReservationFilter filter, Pageable pageable) {
        OffsetDateTime from = filter.from() != null ? filter.from() : OffsetDateTime.now(clock).minusDays(30);
        OffsetDateTime to = filter.to() != null ? filter.to() : from.plusDays(90);
        if (!from.isBefore(to)) {
            throw ProblemException.validation("reservation.invalid_range", "from must be before to");
        }
        return reservationRepository.search(filter.spaceId(), filter.status(), from, to, context, pageable);
    }

    /**
     * Active bookings on the space that intersect {@code [start, end)}; empty means the window is free.
     */
    @Transactional(readOnly = true)
    public List<Reservation> findConflicts(TenantContext context, UUID spaceId, OffsetDateTime start, OffsetDateTime end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw ProblemException.validation("reservation.invalid_window", "end must be after start");
        }
        spaceRepository.findById(spaceId, context)
                .orElseThrow(() -> ProblemException.notFound("space.not_found", "Space not found: " + spaceId));
        return reservationRepository.findActiveOverlapping(spaceId, start, end, context);
    }

    /**
     * Moves every active booking whose end has passed to its terminal status. Safe to run repeatedly:
     * the conditional update matches nothing for rows that already left {@code ACTIVE}.
     */
    public int expireOverdue() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TenantContext platform = TenantContext.platform();
        ReservationStatus uncheckedStatus = requireCheckIn ? ReservationStatus.NO_SHOW : ReservationStatus.EXPIRED;
        List<Reservation> overdue = requiresNewTransaction.execute(status ->
                reservationRepository.findOverdue(now, platform, PageRequest.of(0, sweepBatchSize)));
        int closed = 0;
        for (Reservation reservation : overdue) {
            Integer updated = requiresNewTransaction.execute(status ->
                    reservationRepository.closeIfOverdue(reservation.getId(), uncheckedStatus, now));
            if (updated == null || updated == 0) {
                continue;
            }
            closed++;
            recomputeQuietly(platform.actingFor(reservation.getTenantId()), reservation.getSpaceId(), null,
                    StateChangeSource.RESERVATION_SWEEP);
        }
        return closed;
    }

    /**
     * Recomputes spaces whose booking window has opened since their last recompute, so they show
     * {@code RESERVED} from the start time on.
     */
    public int activateStartedWindows() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TenantContext platform = TenantContext.platform();
        List<UUID> spaceIds = requiresNewTransaction.execute(status ->
                reservationRepository.findSpacesWithOpenedWindow(now, platform));
        int activated = 0;
        for (UUID spaceId : spaceIds) {
            SpaceState state = recomputeQuietly(platform, spaceId, null, StateChangeSource.RESERVATION_SWEEP);
            if (state == SpaceState.RESERVED) {
                activated++;
            }
        }
        return activated;
    }

    private Reservation runStatusChange(TenantContext context, UUID reservationId,
                                        Consumer<Reservation> change) {
        try {
            return requiresNewTransaction.execute(status -> {
                Reservation reservation = reservationRepository.findById(reservationId, context)
                        .orElseThrow(() -> notFound(reservationId));
                context.requireAccess(reservation, "reservation");
                if (reservation.getStatus().isTerminal()) {
                    throw notActive(reservation);
                }
                change.accept(reservation);
                return reservationRepository.saveAndFlush(reservation);
            });
        } catch (OptimisticLockingFailureException ex) {
            throw ProblemException.conflict("reservation.not_active",
                    "Reservation was changed concurrently and is no longer active")
                    .with("reservationId", reservationId);
        }
    }

    private Optional<Reservation> findByRequestId(TenantContext owner, String requestId) {
        return requiresNewTransaction.execute(status ->
                reservationRepository.findByRequestId(owner.tenantId(), requestId));
    }

    private RuntimeException translateInsertViolation(DataIntegrityViolationException ex, TenantContext owner,
                                                      CreateReservationCommand command) {
        String message = rootMessage(ex);
        if (message.contains(OVERLAP_CONSTRAINT)) {
            return overlapConflict(owner, command);
        }
        if (message.contains("ck_reservation_window") || message.contains("ck_reservation_max_duration")) {
            return ProblemException.validation("reservation.invalid_window", "Invalid reservation window");
        }
        return ex;
    }

    private ProblemException overlapConflict(TenantContext owner, CreateReservationCommand command) {
        List<Reservation> conflicts = requiresNewTransaction.execute(status ->
                reservationRepository.findActiveOverlapping(command.spaceId(), command.startTime(),
                        command.endTime(), owner));
        ProblemException conflict = ProblemException.conflict("reservation.overlap",
                "Space is already reserved for an overlapping window");
        if (conflicts != null && !conflicts.isEmpty()) {
            conflict.with("conflictingReservationId", conflicts.get(0).getId());
        }
        return conflict;
    }

    private SpaceState recomputeQuietly(TenantContext context, UUID spaceId, String requestId) {
        return recomputeQuietly(context, spaceId, requestId, StateChangeSource.RESERVATION);
    }

    private SpaceState recomputeQuietly(TenantContext context, UUID spaceId, String requestId,
                                        StateChangeSource source) {
        try {
            return spaceStateService.recompute(context, spaceId, source, requestId);
        } catch (OptimisticLockingFailureException ex) {
            // the reservation row is committed; the next sweep or trigger recomputes the space
            log.warn("Recompute of space {} after reservation change gave up: {}", spaceId, ex.getMessage());
            return null;
        }
    }

    private String validateRequestId(String requestId) {
        if (!StringUtils.hasText(requestId)) {
            throw ProblemException.validation("reservation.request_id_required", "requestId is required");
        }
        String trimmed = requestId.trim();
        if (trimmed.length() > MAX_REQUEST_ID_LENGTH) {
            throw ProblemException.validation("reservation.request_id_too_long", "requestId must be at most 128 characters");
        }
        return trimmed;
    }

    private void validateWindow(OffsetDateTime start, OffsetDateTime end, OffsetDateTime now) {
        if (start == null || end == null) {
            throw ProblemException.validation("reservation.invalid_window", "startTime and endTime are required");
        }
        if (!end.isAfter(start)) {
            throw ProblemException.validation("reservation.invalid_window", "endTime must be after startTime");
        }
        if (Duration.between(start, end).compareTo(maxDuration) > 0) {
            throw ProblemException.validation("reservation.too_long", "Reservations may last at most " + maxDuration);
        }
        if (!end.isAfter(now)) {
            throw ProblemException.validation("reservation.in_past", "Reservation window has already ended");
        }
    }

    private static String rootMessage(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        return root.getMessage() != null ? root.getMessage() : "";
    }

    private static ProblemException notFound(UUID reservationId) {
        return ProblemException.notFound("reservation.not_found", "Reservation not found: " + reservationId);
    }

    private static ProblemException notActive(Reservation reservation) {
        return ProblemException.conflict("reservation.not_active", "Reservation is already " + reservation.getStatus())
                .with("reservationId", reservation.getId())
                .with("status", reservation.getStatus());
    }

    public record CreateReservationCommand(
            UUID spaceId,
            OffsetDateTime startTime,
            OffsetDateTime endTime,
            String requestId,
            String requesterEmail,
            String requesterName,
            String notes
    ) {
    }

    public record CreateReservationResult(Reservation reservation, boolean created) {
    }

    public record ReservationFilter(UUID spaceId, ReservationStatus status, OffsetDateTime from, OffsetDateTime to) {
    }
}
