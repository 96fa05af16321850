package com.phillippitts.slawatch.service.telemetry.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Consistent point-in-time view of the breaker, for health reporting.
 *
 * @param state         current state
 * @param failureCount  consecutive failures counted toward the threshold
 * @param lastFailureAt time of the most recent failure, or null
 * @param openedAt      time the circuit last opened, or null
 * @param cooldown      cooldown that applies to the current (or next) open period
 */
public record BreakerSnapshot(
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        Instant openedAt,
        Duration cooldown
) {
}
