package com.spacesync.backend.modules.tenant.domain;

public enum SubscriptionTier {
    BASIC,
    PROFESSIONAL,
    ENTERPRISE
}
