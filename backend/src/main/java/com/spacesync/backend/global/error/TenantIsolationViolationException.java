package com.spacesync.backend.global.error;

import java.util.UUID;

/**
 * A read or write would have crossed a tenant boundary. Must never happen through the scoped
 * repositories; seeing one means a code path bypassed them.
 */
public class TenantIsolationViolationException extends RuntimeException {

    private final UUID callerTenantId;
    private final UUID rowTenantId;

    public TenantIsolationViolationException(String resource, UUID callerTenantId, UUID rowTenantId) {
        super("Tenant " + callerTenantId + " attempted to access " + resource + " of tenant " + rowTenantId);
        this.callerTenantId = callerTenantId;
        this.rowTenantId = rowTenantId;
    }

    public UUID getCallerTenantId() {
        return callerTenantId;
    }

    public UUID getRowTenantId() {
        return rowTenantId;
    }
}
