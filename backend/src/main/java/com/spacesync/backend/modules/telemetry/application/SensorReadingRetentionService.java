package com.spacesync.backend.modules.telemetry.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.spacesync.backend.modules.telemetry.infrastructure.persistence.SensorReadingRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Drops sensor readings older than the retention window. Deletes run in bounded batches, each in
 * its own transaction. Frame counters live on the device row and are not affected.
 */
@Service
public class SensorReadingRetentionService {

    private static final Logger log = LoggerFactory.getLogger(SensorReadingRetentionService.class);

    private final SensorReadingRepository sensorReadingRepository;
    private final TransactionTemplate requiresNewTransaction;
    private final Clock clock;
    private final Duration retention;
    private final int batchSize;

    public SensorReadingRetentionService(
            SensorReadingRepository sensorReadingRepository,
            @Qualifier("requiresNewTransactionTemplate") TransactionTemplate requiresNewTransaction,
            Clock clock,
            @Value("${app.telemetry.reading-retention:P90D}") Duration retention,
            @Value("${app.telemetry.retention-batch-size:5000}") int batchSize
    ) {
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("app.telemetry.reading-retention must be positive");
        }
        this.sensorReadingRepository = sensorReadingRepository;
        this.requiresNewTransaction = requiresNewTransaction;
        this.clock = clock;
        this.retention = retention;
        this.batchSize = batchSize;
    }

    /**
     * Returns the number of readings deleted.
     */
    public int purgeExpired() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        int total = 0;
        int deleted;
        do {
            Integer batch = requiresNewTransaction.execute(
                    status -> sensorReadingRepository.deleteReceivedBefore(cutoff, batchSize));
            deleted = batch != null ? batch : 0;
            total += deleted;
        } while (deleted == batchSize);
        if (total > 0) {
            log.info("Deleted {} sensor readings received before {}", total, cutoff);
        }
        return total;
    }
}
