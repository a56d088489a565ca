package com.spacesync.backend.modules.device.domain;

public enum DeviceKind {
    SENSOR,
    DISPLAY
}
