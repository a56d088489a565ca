package com.spacesync.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * Temporary rejection. The handler adds a {@code Retry-After} header in whole seconds, never less
 * than one.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        this.retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(seconds, 1);
    }
}
