package com.spacesync.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the periodic sweeps (reservation expiry, spool replay, auto-release, downlink dispatch).
 * Integration tests switch it off and drive the sweeps directly.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.scheduling.enabled", havingValue = "true", matchIfMissing = true)
@EnableScheduling
public class SchedulingConfig {
}
