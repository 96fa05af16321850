package com.phillippitts.slawatch.service.telemetry.event;

import com.phillippitts.slawatch.exception.IngestException;

import java.time.Instant;

/**
 * Published when the remote backend refuses an event for a reason retrying cannot fix
 * (authentication or validation).
 *
 * @param eventId id of the refused event
 * @param channel channel the event belongs to
 * @param kind    AUTH or VALIDATION
 * @param message backend error message
 * @param at      when the refusal was observed
 */
public record IngestRejectedEvent(
        String eventId,
        String channel,
        IngestException.Kind kind,
        String message,
        Instant at
) {}
