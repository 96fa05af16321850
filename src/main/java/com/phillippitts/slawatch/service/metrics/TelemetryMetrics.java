package com.phillippitts.slawatch.service.metrics;

import com.phillippitts.slawatch.domain.DeliveryOutcome;
import com.phillippitts.slawatch.exception.IngestException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized Micrometer instrumentation for response-time monitoring and telemetry shipping.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Response time per channel</li>
 *   <li>SLA violations per channel</li>
 *   <li>Delivery outcomes (delivered, queued, rejected)</li>
 *   <li>Failed remote attempts per error kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
public class TelemetryMetrics {

    private static final String METRIC_PREFIX = "slawatch";

    private final MeterRegistry registry;

    public TelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records an observed response time.
     *
     * @param channel support channel
     * @param elapsed measured response time
     */
    public void recordResponseTime(String channel, Duration elapsed) {
        Timer.builder(METRIC_PREFIX + ".response.time")
                .description("Observed support-channel response time")
                .tag("channel", channel)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Increments the SLA violation counter for a channel.
     *
     * @param channel support channel
     */
    public void incrementSlaViolation(String channel) {
        Counter.builder(METRIC_PREFIX + ".sla.violations")
                .description("Number of response times above the SLA threshold")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }

    /**
     * Counts the final outcome of a send.
     *
     * @param outcome delivered, queued or rejected
     */
    public void recordDelivery(DeliveryOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".telemetry.delivery")
                .description("Telemetry events by final delivery outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts a failed remote attempt.
     *
     * @param kind classified failure kind, or "timeout"/"unknown"
     */
    public void incrementAttemptFailure(String kind) {
        Counter.builder(METRIC_PREFIX + ".telemetry.attempt.failures")
                .description("Failed remote delivery attempts by error kind")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public static String kindTag(IngestException.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
