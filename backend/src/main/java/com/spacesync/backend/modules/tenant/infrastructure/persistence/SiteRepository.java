package com.spacesync.backend.modules.tenant.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.tenant.domain.Site;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

public interface SiteRepository extends Repository<Site, UUID> {

    <S extends Site> S save(S site);

    @Query("select s from Site s where s.id = :id and (s.tenantId = :tenantId or :platformAdmin = true)")
    Optional<Site> findScoped(@Param("id") UUID id,
                              @Param("tenantId") UUID tenantId,
                              @Param("platformAdmin") boolean platformAdmin);

    default Optional<Site> findById(UUID id, TenantContext context) {
        return findScoped(id, context.tenantId(), context.platformAdmin());
    }
}
