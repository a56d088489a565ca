package com.spacesync.backend.modules.downlink.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.global.tenant.TenantContext;
import com.spacesync.backend.modules.device.domain.DisplayDevice;
import com.spacesync.backend.modules.device.infrastructure.persistence.DisplayDeviceRepository;
import com.spacesync.backend.modules.downlink.domain.DisplayPolicy;
import com.spacesync.backend.modules.downlink.domain.DisplayPolicy.Instruction;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommand;
import com.spacesync.backend.modules.downlink.domain.DownlinkCommandType;
import com.spacesync.backend.modules.downlink.domain.DownlinkStatus;
import com.spacesync.backend.modules.downlink.infrastructure.persistence.DownlinkCommandRepository;
import com.spacesync.backend.modules.downlink.infrastructure.transport.DownlinkTransport;
import com.spacesync.backend.modules.downlink.infrastructure.transport.DownlinkTransportException;
import com.spacesync.backend.modules.space.domain.SpaceState;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Display command queue. Delivery is best effort: a command is attempted a bounded number of
 * times and then parked as {@code FAILED} for operators. Nothing here ever feeds back into the
 * logical state of a space.
 */
@Service
public class DownlinkQueueService {

    private static final Logger log = LoggerFactory.getLogger(DownlinkQueueService.class);

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 10;
    static final String DISPATCH_METRIC = "spacesync.downlink.dispatch";

    private final DownlinkCommandRepository downlinkCommandRepository;
    private final DisplayDeviceRepository displayDeviceRepository;
    private final DownlinkTransport transport;
    private final DownlinkRetryPolicy retryPolicy;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate requiresNewTransaction;
    private final Clock clock;
    private final int dispatchBatchSize;
    private final Duration claimLease;

    public DownlinkQueueService(
            DownlinkCommandRepository downlinkCommandRepository,
            DisplayDeviceRepository displayDeviceRepository,
            DownlinkTransport transport,
            DownlinkRetryPolicy retryPolicy,
            MeterRegistry meterRegistry,
            @Qualifier("requiresNewTransactionTemplate") TransactionTemplate requiresNewTransaction,
            Clock clock,
            @Value("${app.downlink.dispatch-batch-size:100}") int dispatchBatchSize,
            @Value("${app.downlink.claim-lease:PT1M}") Duration claimLease
    ) {
        this.downlinkCommandRepository = downlinkCommandRepository;
        this.displayDeviceRepository = displayDeviceRepository;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.requiresNewTransaction = requiresNewTransaction;
        this.clock = clock;
        this.dispatchBatchSize = dispatchBatchSize;
        this.claimLease = claimLease;
    }

    @Transactional
    public DownlinkCommand enqueue(TenantContext context, EnqueueCommand command) {
        if (command.priority() < HIGHEST_PRIORITY || command.priority() > LOWEST_PRIORITY) {
            throw ProblemException.validation("downlink.invalid_priority", "priority must be between 1 and 10");
        }
        DisplayDevice device = displayDeviceRepository.findById(command.deviceId(), context)
                .orElseThrow(() -> ProblemException.notFound("device.not_found", "Display not found: " + command.deviceId()));
        Map<String, Object> payload = command.payload() != null ? command.payload() : Map.of();
        validatePayload(command.type(), payload);

        DownlinkCommand queued = downlinkCommandRepository.save(DownlinkCommand.queue(
                device.getTenantId(),
                device.getId(),
                device.getDevEui(),
                device.getAssignedSpaceId(),
                command.type(),
                payload,
                command.priority(),
                context.actorId(),
                OffsetDateTime.now(clock)
        ));
        log.debug("Queued {} for display {} at priority {}", command.type(), device.getDevEui(), command.priority());
        return queued;
    }

    /**
     * Queues the colour for {@code state}. Older display updates still waiting for the same device
     * are abandoned since they are superseded.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DownlinkCommand enqueueDisplayState(UUID tenantId, UUID displayDeviceId, SpaceState state) {
        TenantContext owner = TenantContext.platform().actingFor(tenantId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        downlinkCommandRepository.abandonQueuedScoped(displayDeviceId, DownlinkCommandType.SET_DISPLAY,
                "superseded", now, owner.tenantId(), false);
        Instruction instruction = DisplayPolicy.forState(state);
        return enqueue(owner, new EnqueueCommand(displayDeviceId, DownlinkCommandType.SET_DISPLAY,
                instruction.toPayload(), DisplayPolicy.DISPLAY_UPDATE_PRIORITY));
    }

    /**
     * Sends the head command of every device that is due.
     *
     * <p>Commands are claimed in one short transaction: locked rows are skipped, so concurrent
     * dispatchers never pick the same command, and each claim counts the attempt and leases the
     * command. The network call runs outside any transaction and each outcome is recorded in its own.
     */
    public DispatchSummary dispatchDue() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<DownlinkCommand> claimed = requiresNewTransaction.execute(status -> claimDue(now));
        int sent = 0;
        int retried = 0;
        int failed = 0;
        for (DownlinkCommand command : claimed) {
            DispatchResult result;
            try {
                result = dispatch(command);
            } catch (RuntimeException ex) {
                count("error");
                log.error("[ALERT] Downlink {} to {} could not be dispatched, retrying after its lease", command.getId(),
                        command.getDevEui(), ex);
                continue;
            }
            switch (result) {
                case SENT -> sent++;
                case RETRY -> retried++;
                case FAILED -> failed++;
                case SKIPPED -> {
                }
            }
        }
        return new DispatchSummary(sent, retried, failed);
    }

    private List<DownlinkCommand> claimDue(OffsetDateTime now) {
        List<DownlinkCommand> due = downlinkCommandRepository.lockDispatchable(now, dispatchBatchSize);
        OffsetDateTime leaseUntil = now.plus(claimLease);
        for (DownlinkCommand command : due) {
            command.claim(leaseUntil, now);
            downlinkCommandRepository.save(command);
        }
        return due;
    }

    private DispatchResult dispatch(DownlinkCommand claimed) {
        String queueId;
        try {
            queueId = transport.send(claimed);
        } catch (DownlinkTransportException ex) {
            return requiresNewTransaction.execute(status -> recordSendFailure(claimed, ex.getMessage()));
        }
        return requiresNewTransaction.execute(status -> recordSent(claimed, queueId));
    }

    private DispatchResult recordSent(DownlinkCommand claimed, String queueId) {
        Optional<DownlinkCommand> current = reloadClaimed(claimed);
        if (current.isEmpty()) {
            return DispatchResult.SKIPPED;
        }
        DownlinkCommand command = current.get();
        command.markSent(queueId, OffsetDateTime.now(clock));
        downlinkCommandRepository.save(command);
        count("sent");
        return DispatchResult.SENT;
    }

    private DispatchResult recordSendFailure(DownlinkCommand claimed, String error) {
        Optional<DownlinkCommand> current = reloadClaimed(claimed);
        if (current.isEmpty()) {
            return DispatchResult.SKIPPED;
        }
        DownlinkCommand command = current.get();
        boolean exhausted = retryPolicy.isExhausted(command.getAttempts());
        command.recordFailure(error, exhausted, retryPolicy.backoffAfter(command.getAttempts()),
                OffsetDateTime.now(clock));
        downlinkCommandRepository.save(command);
        if (exhausted) {
            count("failed");
            log.warn("[ALERT] Downlink {} to {} failed after {} attempts: {}", command.getId(),
                    command.getDevEui(), command.getAttempts(), error);
            return DispatchResult.FAILED;
        }
        count("retry");
        log.info("Downlink {} to {} attempt {} failed, retrying at {}", command.getId(),
                command.getDevEui(), command.getAttempts(), command.getNextAttemptAt());
        return DispatchResult.RETRY;
    }

    /**
     * The claimed command, unless it was abandoned or claimed again while the send was in flight.
     */
    private Optional<DownlinkCommand> reloadClaimed(DownlinkCommand claimed) {
        Optional<DownlinkCommand> current = downlinkCommandRepository.lockById(claimed.getId())
                .filter(command -> command.getStatus() == DownlinkStatus.QUEUED)
                .filter(command -> command.getAttempts() == claimed.getAttempts());
        if (current.isEmpty()) {
            log.debug("Downlink {} changed while in flight, outcome of attempt {} discarded",
                    claimed.getId(), claimed.getAttempts());
        }
        return current;
    }

    /**
     * Applies a confirmation from the network server. Returns the matched command, if any.
     */
    @Transactional
    public Optional<DownlinkCommand> confirm(String networkQueueId, boolean acknowledged) {
        Optional<DownlinkCommand> match = downlinkCommandRepository.findByNetworkQueueId(networkQueueId);
        if (match.isEmpty()) {
            log.debug("Confirmation for unknown queue item {}", networkQueueId);
            return Optional.empty();
        }
        DownlinkCommand command = match.get();
        if (command.getStatus() != DownlinkStatus.SENT) {
            return match;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (acknowledged) {
            command.markDelivered(now);
            count("delivered");
        } else {
            boolean exhausted = retryPolicy.isExhausted(command.getAttempts());
            command.recordFailure("device did not acknowledge", exhausted,
                    retryPolicy.backoffAfter(command.getAttempts()), now);
            count(exhausted ? "failed" : "retry");
            if (exhausted) {
                log.warn("[ALERT] Downlink {} to {} not acknowledged after {} attempts", command.getId(),
                        command.getDevEui(), command.getAttempts());
            }
        }
        return Optional.of(downlinkCommandRepository.save(command));
    }

    @Transactional
    public int clearQueue(TenantContext context, UUID deviceId) {
        displayDeviceRepository.findById(deviceId, context)
                .orElseThrow(() -> ProblemException.notFound("device.not_found", "Display not found: " + deviceId));
        int cleared = downlinkCommandRepository.abandonQueuedScoped(deviceId, null, "cleared by operator",
                OffsetDateTime.now(clock), context.tenantId(), context.platformAdmin());
        log.info("Cleared {} queued downlinks for display {} by {}", cleared, deviceId, context.actorId());
        return cleared;
    }

    @Transactional(readOnly = true)
    public Page<DownlinkCommand> history(TenantContext context, UUID deviceId, Pageable pageable) {
        return downlinkCommandRepository.findHistory(deviceId, context, pageable);
    }

    @Transactional(readOnly = true)
    public Page<DownlinkCommand> failed(TenantContext context, Pageable pageable) {
        return downlinkCommandRepository.findFailed(context, pageable);
    }

    private void validatePayload(DownlinkCommandType type, Map<String, Object> payload) {
        try {
            if (type == DownlinkCommandType.SET_DISPLAY) {
                Instruction.fromPayload(payload);
            } else if (type == DownlinkCommandType.RAW) {
                Object data = payload.get("data");
                if (data == null) {
                    throw new IllegalArgumentException("payload.data is required");
                }
                Base64.getDecoder().decode(data.toString());
            }
        } catch (IllegalArgumentException ex) {
            throw ProblemException.validation("downlink.invalid_payload", ex.getMessage());
        }
    }

    private void count(String result) {
        meterRegistry.counter(DISPATCH_METRIC, "result", result).increment();
    }

    public record EnqueueCommand(UUID deviceId, DownlinkCommandType type, Map<String, Object> payload, int priority) {
    }

    private enum DispatchResult {
        SENT,
        RETRY,
        FAILED,
        SKIPPED
    }

    public record DispatchSummary(int sent, int retried, int failed) {

        public int total() {
            return sent + retried + failed;
        }
    }
}
