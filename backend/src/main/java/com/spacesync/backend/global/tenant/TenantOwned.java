package com.spacesync.backend.global.tenant;

import java.util.UUID;

/**
 * Row that lives inside exactly one tenant partition.
 */
public interface TenantOwned {

    UUID getTenantId();
}
