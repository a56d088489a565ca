package com.spacesync.backend.modules.reservation.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * Time-boxed claim on a space over {@code [startTime, endTime)}. Status moves one way from
 * {@code ACTIVE} to a terminal value; terminal rows never change again.
 */
@Entity
@Table(name = "reservation")
public class Reservation extends AbstractTimestampedEntity implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "space_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID spaceId;

    @Column(name = "request_id", nullable = false, updatable = false, length = 128)
    private String requestId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private OffsetDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReservationStatus status = ReservationStatus.ACTIVE;

    @Column(name = "requester_id", columnDefinition = "uuid")
    private UUID requesterId;

    @Column(name = "requester_email", length = 320)
    private String requesterEmail;

    @Column(name = "requester_name", length = 200)
    private String requesterName;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "checked_in_at")
    private OffsetDateTime checkedInAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "cancelled_by", columnDefinition = "uuid")
    private UUID cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Reservation() {
    }

    public static Reservation book(UUID tenantId, UUID spaceId, String requestId, OffsetDateTime startTime,
                                   OffsetDateTime endTime, Requester requester, String notes, OffsetDateTime now) {
        Reservation reservation = new Reservation();
        reservation.tenantId = tenantId;
        reservation.spaceId = spaceId;
        reservation.requestId = requestId;
        reservation.startTime = startTime;
        reservation.endTime = endTime;
        reservation.requesterId = requester.id();
        reservation.requesterEmail = requester.email();
        reservation.requesterName = requester.name();
        reservation.notes = notes;
        reservation.initializeTimestamps(now);
        return reservation;
    }

    public void cancel(UUID actorId, String reason, OffsetDateTime now) {
        requireActive();
        this.status = ReservationStatus.CANCELLED;
        this.cancelledAt = now;
        this.cancelledBy = actorId;
        this.cancellationReason = reason;
        this.closedAt = now;
        touch(now);
    }

    public void checkIn(OffsetDateTime now) {
        requireActive();
        if (!isWindowOpenAt(now)) {
            throw new IllegalStateException("Check-in is only possible inside the reservation window");
        }
        if (checkedInAt == null) {
            this.checkedInAt = now;
            touch(now);
        }
    }

    public boolean isWindowOpenAt(OffsetDateTime at) {
        return !startTime.isAfter(at) && endTime.isAfter(at);
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    private void requireActive() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Reservation is already " + status);
        }
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getSpaceId() {
        return spaceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    public ReservationStatus getStatus() {
        return status;
    }

    public UUID getRequesterId() {
        return requesterId;
    }

    public String getRequesterEmail() {
        return requesterEmail;
    }

    public String getRequesterName() {
        return requesterName;
    }

    public String getNotes() {
        return notes;
    }

    public OffsetDateTime getCheckedInAt() {
        return checkedInAt;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public UUID getCancelledBy() {
        return cancelledBy;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public long getVersion() {
        return version;
    }

    public record Requester(UUID id, String email, String name) {
    }
}
