package com.phillippitts.slawatch.service.telemetry.event;

import java.time.Instant;

/**
 * Published when the local backlog could not persist an event.
 *
 * @param eventId  id of the event that could not be written
 * @param location file or directory that failed
 * @param dropped  true when the event exhausted its write attempts and was discarded
 * @param at       when the failure was observed
 */
public record LocalStorageFailureEvent(
        String eventId,
        String location,
        boolean dropped,
        Instant at
) {}
