package com.spacesync.backend.modules.device.domain;

public enum AssignmentAction {
    ASSIGNED,
    UNASSIGNED
}
