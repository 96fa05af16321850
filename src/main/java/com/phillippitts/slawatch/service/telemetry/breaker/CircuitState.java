package com.phillippitts.slawatch.service.telemetry.breaker;

/**
 * Health of the remote ingestion backend as seen by the circuit breaker.
 */
public enum CircuitState {
    /** Requests allowed; failures accumulate. */
    CLOSED,
    /** Requests blocked without a network attempt until the cooldown elapses. */
    OPEN,
    /** Exactly one trial request allowed; its result decides CLOSED or OPEN. */
    HALF_OPEN
}
