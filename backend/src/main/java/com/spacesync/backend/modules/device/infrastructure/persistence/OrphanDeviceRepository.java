package com.spacesync.backend.modules.device.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.modules.device.domain.OrphanDevice;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Orphans belong to no tenant. Reads are exposed to platform admins only, enforced at the endpoint.
 */
public interface OrphanDeviceRepository extends Repository<OrphanDevice, UUID> {

    @Modifying
    @Query(value = """
            insert into orphan_device (id, dev_eui, first_seen_at, last_seen_at, message_count, last_event, last_payload)
            values (gen_random_uuid(), :devEui, :now, :now, 1, :event, cast(:payload as jsonb))
            on conflict (dev_eui) do update
               set last_seen_at = excluded.last_seen_at,
                   message_count = orphan_device.message_count + 1,
                   last_event = excluded.last_event,
                   last_payload = excluded.last_payload
            """, nativeQuery = true)
    int recordSighting(@Param("devEui") String devEui,
                       @Param("event") String event,
                       @Param("payload") String payload,
                       @Param("now") OffsetDateTime now);

    Optional<OrphanDevice> findByDevEui(String devEui);

    @Query("select o from OrphanDevice o order by o.lastSeenAt desc")
    Page<OrphanDevice> findRecent(Pageable pageable);

    @Modifying
    @Query("delete from OrphanDevice o where o.devEui = :devEui")
    int deleteByDevEui(@Param("devEui") String devEui);
}
