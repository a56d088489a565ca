package com.spacesync.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Telemetry seen from a hardware id that no tenant has registered. Written only by the native
 * upsert in {@code OrphanDeviceRepository}; read-only here.
 */
@Entity
@Immutable
@Table(name = "orphan_device")
public class OrphanDevice {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "dev_eui", nullable = false, length = 16)
    private String devEui;

    @Column(name = "first_seen_at", nullable = false)
    private OffsetDateTime firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private OffsetDateTime lastSeenAt;

    @Column(name = "message_count", nullable = false)
    private long messageCount;

    @Column(name = "last_event", length = 16)
    private String lastEvent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "last_payload", columnDefinition = "jsonb")
    private String lastPayload;

    protected OrphanDevice() {
    }

    public UUID getId() {
        return id;
    }

    public String getDevEui() {
        return devEui;
    }

    public OffsetDateTime getFirstSeenAt() {
        return firstSeenAt;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public long getMessageCount() {
        return messageCount;
    }

    public String getLastEvent() {
        return lastEvent;
    }

    public String getLastPayload() {
        return lastPayload;
    }
}
