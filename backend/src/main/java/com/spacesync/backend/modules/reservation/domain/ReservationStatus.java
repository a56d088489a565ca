package com.spacesync.backend.modules.reservation.domain;

public enum ReservationStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED,
    EXPIRED,
    NO_SHOW;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
