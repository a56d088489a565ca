package com.spacesync.backend.modules.reservation.presentation;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.reservation.application.ReservationService;
import com.spacesync.backend.modules.reservation.application.ReservationService.CreateReservationCommand;
import com.spacesync.backend.modules.reservation.application.ReservationService.CreateReservationResult;
import com.spacesync.backend.modules.reservation.application.ReservationService.ReservationFilter;
import com.spacesync.backend.modules.reservation.domain.Reservation;
import com.spacesync.backend.modules.reservation.domain.ReservationStatus;
import com.spacesync.backend.modules.reservation.presentation.dto.AvailabilityResponse;
import com.spacesync.backend.modules.reservation.presentation.dto.CancelReservationRequest;
import com.spacesync.backend.modules.reservation.presentation.dto.CreateReservationRequest;
import com.spacesync.backend.modules.reservation.presentation.dto.ReservationListResponse;
import com.spacesync.backend.modules.reservation.presentation.dto.ReservationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reservations")
@Tag(name = "Reservations", description = "Idempotent, overlap-free space bookings")
public class ReservationController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ReservationService reservationService;

    public ReservationController(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @PostMapping
    @Operation(summary = "Book a space; replaying a requestId returns the original booking")
    public ResponseEntity<ReservationResponse> create(TenantContext tenant,
                                                      @Valid @RequestBody CreateReservationRequest request) {
        CreateReservationResult result = reservationService.create(tenant, new CreateReservationCommand(
                request.spaceId(),
                request.startTime(),
                request.endTime(),
                request.requestId(),
                request.requesterEmail(),
                request.requesterName(),
                request.notes()
        ));
        ReservationResponse body = ReservationResponse.from(result.reservation());
        if (!result.created()) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.created(URI.create("/reservations/" + body.id())).body(body);
    }

    @GetMapping
    public ResponseEntity<ReservationListResponse> list(
            TenantContext tenant,
            @RequestParam(name = "spaceId", required = false) UUID spaceId,
            @RequestParam(name = "status", required = false) ReservationStatus status,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<Reservation> result = reservationService.list(tenant, new ReservationFilter(spaceId, status, from, to),
                PageRequest.of(safePage, safeSize));
        List<ReservationResponse> items = result.getContent().stream().map(ReservationResponse::from).toList();
        return ResponseEntity.ok(new ReservationListResponse(items, safePage, safeSize, result.getTotalElements()));
    }

    @GetMapping("/availability")
    @Operation(summary = "Active bookings that would collide with a window")
    public ResponseEntity<AvailabilityResponse> availability(
            TenantContext tenant,
            @RequestParam("spaceId") UUID spaceId,
            @RequestParam("startTime") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startTime,
            @RequestParam("endTime") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endTime
    ) {
        List<ReservationResponse> conflicts = reservationService.findConflicts(tenant, spaceId, startTime, endTime)
                .stream()
                .map(ReservationResponse::from)
                .toList();
        return ResponseEntity.ok(new AvailabilityResponse(spaceId, startTime, endTime, conflicts.isEmpty(), conflicts));
    }

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> get(TenantContext tenant,
                                                   @PathVariable("reservationId") UUID reservationId) {
        return ResponseEntity.ok(ReservationResponse.from(reservationService.get(tenant, reservationId)));
    }

    @PostMapping("/{reservationId}/cancel")
    @Operation(summary = "Cancel an active booking")
    public ResponseEntity<ReservationResponse> cancel(TenantContext tenant,
                                                      @PathVariable("reservationId") UUID reservationId,
                                                      @Valid @RequestBody(required = false) CancelReservationRequest request) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(ReservationResponse.from(reservationService.cancel(tenant, reservationId, reason)));
    }

    @PostMapping("/{reservationId}/check-in")
    public ResponseEntity<ReservationResponse> checkIn(TenantContext tenant,
                                                       @PathVariable("reservationId") UUID reservationId) {
        return ResponseEntity.ok(ReservationResponse.from(reservationService.checkIn(tenant, reservationId)));
    }
}
