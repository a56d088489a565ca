package com.spacesync.backend.modules.downlink.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class DownlinkRetryPolicyTest {

    private final DownlinkRetryPolicy policy = new DownlinkRetryPolicy(3, Duration.ofSeconds(30));

    @Test
    void exhaustsAfterThreeAttempts() {
        assertThat(policy.isExhausted(1)).isFalse();
        assertThat(policy.isExhausted(2)).isFalse();
        assertThat(policy.isExhausted(3)).isTrue();
    }

    @Test
    void exponentialBackoff() {
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoffAfter(0)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new DownlinkRetryPolicy(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DownlinkRetryPolicy(3, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
