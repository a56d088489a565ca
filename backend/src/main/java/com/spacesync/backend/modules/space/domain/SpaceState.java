package com.spacesync.backend.modules.space.domain;

public enum SpaceState {
    FREE,
    OCCUPIED,
    RESERVED,
    MAINTENANCE,
    UNKNOWN
}
