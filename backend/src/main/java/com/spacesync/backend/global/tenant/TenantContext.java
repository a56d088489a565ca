package com.spacesync.backend.global.tenant;

import java.util.Objects;
import java.util.UUID;

import com.spacesync.backend.global.error.TenantIsolationViolationException;

/**
 * Caller identity handed explicitly to every service and repository call.
 *
 * <p>Repositories only accept reads through a context: the predicate they apply is
 * {@code tenant_id = tenantId or platformAdmin}. Writes check ownership with {@link #requireAccess}.
 */
public record TenantContext(UUID tenantId, UUID actorId, boolean platformAdmin) {

    public static final UUID PLATFORM_TENANT_ID = new UUID(0L, 0L);

    public TenantContext {
        Objects.requireNonNull(tenantId, "tenantId is required");
    }

    public static TenantContext of(UUID tenantId, UUID actorId) {
        return new TenantContext(tenantId, actorId, false);
    }

    /**
     * Context of the background sweeps and the webhook gate before a device has been resolved.
     */
    public static TenantContext platform() {
        return new TenantContext(PLATFORM_TENANT_ID, null, true);
    }

    /**
     * Narrow this context to the tenant that owns a row, keeping the actor. Used once a row has been
     * resolved through a platform context so downstream writes are stamped with the owning tenant.
     */
    public TenantContext actingFor(UUID owningTenantId) {
        if (!canAccess(owningTenantId)) {
            throw new TenantIsolationViolationException("tenant", tenantId, owningTenantId);
        }
        return new TenantContext(owningTenantId, actorId, platformAdmin);
    }

    public boolean canAccess(UUID rowTenantId) {
        return platformAdmin || tenantId.equals(rowTenantId);
    }

    public <T extends TenantOwned> T requireAccess(T row, String resource) {
        if (row != null && !canAccess(row.getTenantId())) {
            throw new TenantIsolationViolationException(resource, tenantId, row.getTenantId());
        }
        return row;
    }
}
