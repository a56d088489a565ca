package com.spacesync.backend.modules.device.domain;

public enum DeviceLifecycleState {
    PROVISIONED,
    OPERATIONAL
}
