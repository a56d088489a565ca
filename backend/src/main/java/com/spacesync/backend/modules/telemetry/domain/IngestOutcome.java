package com.spacesync.backend.modules.telemetry.domain;

/**
 * What happened to an acknowledged webhook delivery.
 */
public enum IngestOutcome {
    /** frame stored and the owning space recomputed */
    ACCEPTED,
    /** frame counter not above the last accepted one; discarded */
    DUPLICATE,
    /** hardware id not registered; recorded for triage */
    ORPHAN,
    /** device known but not assigned; frame stored, no space affected */
    UNASSIGNED,
    /** delivery for a deactivated tenant or a mismatched tenant header */
    IGNORED,
    /** storage unavailable; written to the spool for replay */
    SPOOLED,
    /** downlink confirmation matched */
    CONFIRMED
}
