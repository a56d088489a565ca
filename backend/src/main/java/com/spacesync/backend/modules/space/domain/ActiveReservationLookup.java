package com.spacesync.backend.modules.space.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;

/**
 * Reservation questions the state machine needs. Implemented by the reservation module.
 */
public interface ActiveReservationLookup {

    /** Whether the space holds an active booking whose window contains {@code at}. */
    boolean hasReservationActiveAt(TenantContext context, UUID spaceId, OffsetDateTime at);

    /** Number of still-active bookings on the space, whatever their window. */
    long countActiveReservations(TenantContext context, UUID spaceId);
}
