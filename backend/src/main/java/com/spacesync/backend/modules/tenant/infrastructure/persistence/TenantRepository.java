package com.spacesync.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.tenant.domain.Tenant;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface TenantRepository extends Repository<Tenant, UUID> {

    <S extends Tenant> S save(S tenant);

    @Query("select t from Tenant t where t.id = :id and (t.id = :tenantId or :platformAdmin = true)")
    Optional<Tenant> findScoped(@Param("id") UUID id,
                                @Param("tenantId") UUID tenantId,
                                @Param("platformAdmin") boolean platformAdmin);

    default Optional<Tenant> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }
}
