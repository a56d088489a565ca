package com.spacesync.backend.modules.space.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Append-only audit row for one transition of a space's derived state.
 */
@Entity
@Immutable
@Table(name = "space_state_change")
public class StateChange implements TenantOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "space_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID spaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state", nullable = false, updatable = false, length = 16)
    private SpaceState previousState;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_state", nullable = false, updatable = false, length = 16)
    private SpaceState newState;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private StateChangeSource source;

    @Column(name = "request_id", updatable = false, length = 128)
    private String requestId;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private OffsetDateTime changedAt;

    protected StateChange() {
    }

    public static StateChange record(Space space, SpaceState previous, StateChangeSource source,
                                     String requestId, OffsetDateTime now) {
        StateChange change = new StateChange();
        change.tenantId = space.getTenantId();
        change.spaceId = space.getId();
        change.previousState = previous;
        change.newState = space.getCurrentState();
        change.source = source;
        change.requestId = requestId;
        change.changedAt = now;
        return change;
    }

    public Long getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public UUID getSpaceId() {
        return spaceId;
    }

    public SpaceState getPreviousState() {
        return previousState;
    }

    public SpaceState getNewState() {
        return newState;
    }

    public StateChangeSource getSource() {
        return source;
    }

    public String getRequestId() {
        return requestId;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }
}
