package com.spacesync.backend.modules.downlink.application;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Bounded retry with exponential backoff: base, 2x base, 4x base, ...
 */
@Component
public class DownlinkRetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final int maxAttempts;
    private final Duration baseBackoff;

    public DownlinkRetryPolicy(
            @Value("${app.downlink.max-attempts:3}") int maxAttempts,
            @Value("${app.downlink.backoff:PT30S}") Duration baseBackoff
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.downlink.max-attempts must be >= 1");
        }
        if (baseBackoff.isNegative() || baseBackoff.isZero()) {
            throw new IllegalArgumentException("app.downlink.backoff must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoff = baseBackoff;
    }

    public boolean isExhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    /**
     * Delay before the next attempt once {@code attempts} attempts have failed.
     */
    public Duration backoffAfter(int attempts) {
        int shift = Math.min(Math.max(attempts - 1, 0), MAX_SHIFT);
        return baseBackoff.multipliedBy(1L << shift);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
