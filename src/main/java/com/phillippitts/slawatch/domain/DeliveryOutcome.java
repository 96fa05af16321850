package com.phillippitts.slawatch.domain;

/**
 * Result of {@code TelemetryClient.send}. Remote unavailability is a normal outcome, never an error.
 */
public enum DeliveryOutcome {
    /** Acknowledged by the remote ingestion service. */
    DELIVERED,
    /** Written to the local backlog; will be resynced later. */
    QUEUED,
    /** Refused by the remote for a non-retriable reason (auth or validation). */
    REJECTED
}
