package com.spacesync.backend.modules.space.domain;

/**
 * Last occupancy reported by the assigned sensor. A {@code null} column means no reading yet.
 */
public enum SensorState {
    FREE,
    OCCUPIED;

    public static SensorState of(boolean occupied) {
        return occupied ? OCCUPIED : FREE;
    }
}
