package com.spacesync.backend.modules.tenant.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.spacesync.backend.global.jpa.AbstractTimestampedEntity;
import com.spacesync.backend.global.tenant.TenantOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "site")
public class Site extends AbstractTimestampedEntity implements TenantOwned {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID tenantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone = "UTC";

    protected Site() {
    }

    public static Site create(Tenant tenant, String name, OffsetDateTime now) {
        Site site = new Site();
        site.tenantId = tenant.getId();
        site.name = name;
        site.initializeTimestamps(now);
        return site;
    }

    public UUID getId() {
        return id;
    }

    @Override
    public UUID getTenantId() {
        return tenantId;
    }

    public String getName() {
        return name;
    }

    public String getTimezone() {
        return timezone;
    }
}
