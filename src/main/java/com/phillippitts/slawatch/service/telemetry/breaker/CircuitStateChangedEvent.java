package com.phillippitts.slawatch.service.telemetry.breaker;

import java.time.Instant;

/**
 * Published by {@link CircuitBreaker} on every state transition.
 */
public record CircuitStateChangedEvent(
        CircuitState from,
        CircuitState to,
        int failureCount,
        Instant at
) {
    public CircuitStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }

    public boolean isRecovery() {
        return to == CircuitState.CLOSED && from != CircuitState.CLOSED;
    }
}
