package com.spacesync.backend.modules.downlink.domain;

public enum DownlinkStatus {
    QUEUED,
    SENT,
    DELIVERED,
    FAILED,
    ABANDONED
}
