package com.spacesync.backend.modules.telemetry.application;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.webhook")
public class WebhookProperties {

    /** platform-default HMAC secret */
    private String secret = "";

    /** per-tenant HMAC secrets, chosen by the X-Tenant-Id header */
    private Map<UUID, String> tenantSecrets = new HashMap<>();

    /** accept unsigned deliveries when no secret is configured (local development only) */
    private boolean allowUnsigned;

    private final Spool spool = new Spool();

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public Map<UUID, String> getTenantSecrets() {
        return tenantSecrets;
    }

    public void setTenantSecrets(Map<UUID, String> tenantSecrets) {
        this.tenantSecrets = tenantSecrets;
    }

    public boolean isAllowUnsigned() {
        return allowUnsigned;
    }

    public void setAllowUnsigned(boolean allowUnsigned) {
        this.allowUnsigned = allowUnsigned;
    }

    public Spool getSpool() {
        return spool;
    }

    public static class Spool {

        private String directory = System.getProperty("java.io.tmpdir") + "/spacesync-spool";
        private long maxBacklogBytes = 64L * 1024 * 1024;
        private Duration retryAfter = Duration.ofSeconds(60);

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getMaxBacklogBytes() {
            return maxBacklogBytes;
        }

        public void setMaxBacklogBytes(long maxBacklogBytes) {
            this.maxBacklogBytes = maxBacklogBytes;
        }

        public Duration getRetryAfter() {
            return retryAfter;
        }

        public void setRetryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
        }
    }
}
