package com.spacesync.backend.modules.space.domain;

public enum StateChangeSource {
    SENSOR,
    RESERVATION,
    RESERVATION_SWEEP,
    MANUAL_OVERRIDE,
    ENABLEMENT,
    ASSIGNMENT,
    AUTO_RELEASE
}
