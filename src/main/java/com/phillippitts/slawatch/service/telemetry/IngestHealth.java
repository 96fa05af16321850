package com.phillippitts.slawatch.service.telemetry;

import com.phillippitts.slawatch.service.telemetry.breaker.CircuitState;

import java.time.Duration;

/**
 * Result of probing the remote ingestion backend, combined with local shipping state.
 *
 * @param healthy      whether the probe was acknowledged
 * @param latency      time the probe took
 * @param error        probe failure description, or null when healthy
 * @param breakerState current circuit state
 * @param failureCount failures counted by the breaker
 * @param backlogSize  events awaiting resync (persisted and buffered in memory)
 * @param version      client version
 * @param apiVersion   ingestion API version
 * @param protocol     transport protocol
 */
public record IngestHealth(
        boolean healthy,
        Duration latency,
        String error,
        CircuitState breakerState,
        int failureCount,
        int backlogSize,
        String version,
        String apiVersion,
        String protocol
) {

    public String status() {
        return healthy ? "healthy" : "unhealthy";
    }
}
