package com.phillippitts.slawatch.service.metrics;

import com.phillippitts.slawatch.domain.DeliveryOutcome;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Result of recording one response time.
 *
 * @param channel   channel the measurement was recorded under (unknown channels become "other")
 * @param elapsed   measured response time
 * @param threshold SLA threshold it was checked against
 * @param aboveSla  whether an alert was raised
 * @param delivery  completes with the MEASUREMENT outcome followed by the ALERT outcome, if any
 */
public record RecordedMeasurement(
        String channel,
        Duration elapsed,
        Duration threshold,
        boolean aboveSla,
        CompletableFuture<List<DeliveryOutcome>> delivery
) {}
