package com.spacesync.backend.modules.downlink.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One queued instruction for a display. Per device, commands leave the queue by priority
 * (1 highest) and then by id.
 */
@Entity
@Table(name = "downlink_command")
public class DownlinkCommand extends AbstractTimestampedEntity implements TenantOwned {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "device_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID deviceId;

    @Column(name = "dev_eui", nullable = false, updatable = false, length = 16)
    private String devEui;

    @Column(name = "space_id", updatable = false, columnDefinition = "uuid")
    private UUID spaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "command_type", nullable = false, updatable = false, length = 32)
    private DownlinkCommandType commandType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Column(name = "priority", nullable = false, updatable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DownlinkStatus status = DownlinkStatus.QUEUED;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at", nullable = false)
    private OffsetDateTime nextAttemptAt;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "network_queue_id", length = 128)
    private String networkQueueId;

    @Column(name = "requested_by", updatable = false, columnDefinition = "uuid")
    private UUID requestedBy;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "delivered_at")
    private OffsetDateTime deliveredAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    protected DownlinkCommand() {
    }

    public static DownlinkCommand queue(UUID tenantId, UUID deviceId, String devEui, UUID spaceId,
                                        DownlinkCommandType type, Map<String, Object> payload, int priority,
                                        UUID requestedBy, OffsetDateTime now) {
        DownlinkCommand command = new DownlinkCommand();
        command.tenantId = tenantId;
        command.deviceId = deviceId;
        command.devEui = devEui;
        command.spaceId = spaceId;
        command.commandType = type;
        command.payload = payload;
        command.priority = priority;
        command.requestedBy = requestedBy;
        command.nextAttemptAt = now;
        command.initializeTimestamps(now);
        return command;
    }

    public void markSent(String networkQueueId, OffsetDateTime now) {
        this.status = DownlinkStatus.SENT;
        this.networkQueueId = networkQueueId;
        this.sentAt = now;
        this.lastError = null;
        touch(now);
    }

    public void markDelivered(OffsetDateTime now) {
        this.status = DownlinkStatus.DELIVERED;
        this.deliveredAt = now;
        this.closedAt = now;
        touch(now);
    }

    /**
     * Records a failed attempt. The command goes back to the queue after {@code backoff} or, once
     * {@code exhausted}, ends as {@code FAILED}.
     */
    public void recordFailure(String error, boolean exhausted, Duration backoff, OffsetDateTime now) {
        this.lastError = truncate(error);
        if (exhausted) {
            this.status = DownlinkStatus.FAILED;
            this.closedAt = now;
        } else {
            this.status = DownlinkStatus.QUEUED;
            this.nextAttemptAt = now.plus(backoff);
        }
        touch(now);
    }

    /**
     * Counts an attempt and keeps the command out of dispatch until {@code leaseUntil}, so a
     * dispatcher that dies mid-send hands it back to the queue with the attempt already counted.
     */
    public void claim(OffsetDateTime leaseUntil, OffsetDateTime now) {
        this.attempts++;
        this.nextAttemptAt = leaseUntil;
        touch(now);
    }

    public void abandon(String reason, OffsetDateTime now) {
        this.status = DownlinkStatus.ABANDONED;
        this.lastError = truncate(reason);
        this.closedAt = now;
        touch(now);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    public Long getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getDeviceId() {
        return deviceId;
    }

    public String getDevEui() {
        return devEui;
    }

    public UUID getSpaceId() {
        return spaceId;
    }

    public DownlinkCommandType getCommandType() {
        return commandType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public int getPriority() {
        return priority;
    }

    public DownlinkStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public OffsetDateTime getNextAttemptAt() {
        return nextAttemptAt;
    }

    public String getLastError() {
        return lastError;
    }

    public String getNetworkQueueId() {
        return networkQueueId;
    }

    public UUID getRequestedBy() {
        return requestedBy;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }

    public OffsetDateTime getDeliveredAt() {
        return deliveredAt;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }
}
