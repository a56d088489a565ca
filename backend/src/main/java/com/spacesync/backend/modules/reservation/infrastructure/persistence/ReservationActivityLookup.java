package com.spacesync.backend.modules.reservation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.space.domain.ActiveReservationLookup;

import org.springframework.stereotype.Component;

@Component
public class ReservationActivityLookup implements ActiveReservationLookup {

    private final ReservationRepository reservationRepository;

    public ReservationActivityLookup(ReservationRepository reservationRepository) {
        this.reservationRepository = reservationRepository;
    }

    @Override
    public boolean hasReservationActiveAt(TenantContext context, UUID spaceId, OffsetDateTime at) {
        return reservationRepository.existsActiveAt(spaceId, at, context);
    }

    @Override
    public long countActiveReservations(TenantContext context, UUID spaceId) {
        return reservationRepository.countActive(spaceId, context);
    }
}
