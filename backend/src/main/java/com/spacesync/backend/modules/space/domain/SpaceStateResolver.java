package com.spacesync.backend.modules.space.domain;

/**
 * Precedence rules for a space's derived state, highest first:
 * <ol>
 *   <li>disabled or maintenance override: {@code MAINTENANCE}</li>
 *   <li>an active reservation whose window contains now: {@code RESERVED}</li>
 *   <li>sensor reports occupied: {@code OCCUPIED}</li>
 *   <li>sensor reports free, or no sensor assigned: {@code FREE}</li>
 *   <li>sensor assigned but silent so far: {@code UNKNOWN}</li>
 * </ol>
 * Reservations that have not started yet do not count.
 */
public final class SpaceStateResolver {

    private SpaceStateResolver() {
    }

    public static SpaceState resolve(Inputs inputs) {
        if (!inputs.enabled() || inputs.maintenanceOverride()) {
            return SpaceState.MAINTENANCE;
        }
        if (inputs.reservationActiveNow()) {
            return SpaceState.RESERVED;
        }
        if (inputs.sensorState() == SensorState.OCCUPIED) {
            return SpaceState.OCCUPIED;
        }
        if (inputs.sensorState() == SensorState.FREE || !inputs.sensorAssigned()) {
            return SpaceState.FREE;
        }
        return SpaceState.UNKNOWN;
    }

    public static SpaceState resolve(Space space, boolean reservationActiveNow) {
        return resolve(new Inputs(
                space.isEnabled(),
                space.isMaintenanceOverride(),
                reservationActiveNow,
                space.getSensorDeviceId() != null,
                space.getSensorState()
        ));
    }

    public record Inputs(
            boolean enabled,
            boolean maintenanceOverride,
            boolean reservationActiveNow,
            boolean sensorAssigned,
            SensorState sensorState
    ) {
    }
}
