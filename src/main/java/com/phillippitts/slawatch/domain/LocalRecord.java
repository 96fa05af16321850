package com.phillippitts.slawatch.domain;

import java.util.Objects;

/**
 * A telemetry event held in the local backlog because remote delivery did not succeed.
 *
 * @param event        the queued event
 * @param synced       whether the record has since been delivered
 * @param attemptCount remote attempts made before the event was queued
 * @param reason       short machine-readable reason the event was queued (e.g. "circuit-open")
 */
public record LocalRecord(
        TelemetryEvent event,
        boolean synced,
        int attemptCount,
        String reason
) {

    public LocalRecord {
        Objects.requireNonNull(event, "event");
        if (attemptCount < 0) {
            throw new IllegalArgumentException("Attempt count must be >= 0, got: " + attemptCount);
        }
        reason = reason == null ? "unknown" : reason;
    }

    /**
     * Creates an unsynced record for an event that could not be delivered.
     */
    public static LocalRecord unsynced(TelemetryEvent event, int attemptCount, String reason) {
        return new LocalRecord(event, false, attemptCount, reason);
    }

    public String id() {
        return event.id();
    }
}
