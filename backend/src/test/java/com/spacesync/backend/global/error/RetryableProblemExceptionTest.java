package com.spacesync.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class RetryableProblemExceptionTest {

    @Test
    void retryAfterRoundsUpToWholeSeconds() {
        assertThat(problem(Duration.ofSeconds(60)).getRetryAfterSeconds()).isEqualTo(60);
        assertThat(problem(Duration.ofMillis(1500)).getRetryAfterSeconds()).isEqualTo(2);
    }

    @Test
    void retryAfterIsNeverBelowOneSecond() {
        assertThat(problem(Duration.ZERO).getRetryAfterSeconds()).isEqualTo(1);
        assertThat(problem(Duration.ofSeconds(-5)).getRetryAfterSeconds()).isEqualTo(1);
        assertThat(problem(null).getRetryAfterSeconds()).isEqualTo(1);
    }

    private static RetryableProblemException problem(Duration retryAfter) {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "webhook.backlog_full", null, retryAfter);
    }
}
