package com.phillippitts.slawatch.service.metrics;

import com.phillippitts.slawatch.config.properties.SlaProperties;
import com.phillippitts.slawatch.domain.DeliveryOutcome;
import com.phillippitts.slawatch.domain.EventKind;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.exception.InvalidMeasurementException;
import com.phillippitts.slawatch.service.alert.AlertJournal;
import com.phillippitts.slawatch.service.ingest.IngestClient;
import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import com.phillippitts.slawatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Records support-channel response times, evaluates them against the SLA and forwards a
 * MEASUREMENT event (always) and an ALERT event (when the SLA is exceeded) to the telemetry client.
 *
 * <p>The ALERT is sent after the MEASUREMENT has settled so both keep their order in the backlog.
 */
public class MetricsCollector {

    private static final Logger LOG = LogManager.getLogger(MetricsCollector.class);

    static final String OTHER_CHANNEL = "other";

    private final TelemetryClient client;
    private final SlaProperties slaProperties;
    private final AlertJournal alertJournal;
    private final TelemetryMetrics metrics;

    private final Set<String> knownChannels;
    private final ConcurrentMap<String, ChannelStatistics> statistics = new ConcurrentHashMap<>();

    public MetricsCollector(TelemetryClient client,
                            SlaProperties slaProperties,
                            AlertJournal alertJournal,
                            TelemetryMetrics metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.slaProperties = Objects.requireNonNull(slaProperties, "slaProperties");
        this.alertJournal = Objects.requireNonNull(alertJournal, "alertJournal");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.knownChannels = slaProperties.getChannels().stream()
                .map(MetricsCollector::normalize)
                .collect(Collectors.toUnmodifiableSet());
        knownChannels.forEach(channel -> statistics.put(channel, new ChannelStatistics()));
    }

    /**
     * Records a response time using the channel's configured SLA threshold.
     */
    public RecordedMeasurement record(String channel, Duration elapsed) {
        String resolved = resolveChannel(channel);
        return recordResolved(resolved, elapsed, slaProperties.thresholdFor(resolved));
    }

    /**
     * Records a response time against an explicit SLA threshold.
     *
     * @throws InvalidMeasurementException if the channel is blank or a duration is null or negative
     */
    public RecordedMeasurement record(String channel, Duration elapsed, Duration slaThreshold) {
        return recordResolved(resolveChannel(channel), elapsed, slaThreshold);
    }

    private RecordedMeasurement recordResolved(String resolved, Duration elapsed, Duration slaThreshold) {
        if (elapsed == null || elapsed.isNegative()) {
            throw new InvalidMeasurementException("Elapsed time must be a non-negative duration, got: " + elapsed);
        }
        if (slaThreshold == null || slaThreshold.isNegative()) {
            throw new InvalidMeasurementException("SLA threshold must be a non-negative duration, got: " + slaThreshold);
        }
        boolean violation = SlaPolicy.isViolation(elapsed, slaThreshold);

        ChannelStatistics.Snapshot snapshot =
                statistics.computeIfAbsent(resolved, c -> new ChannelStatistics()).record(elapsed, violation);
        metrics.recordResponseTime(resolved, elapsed);

        TelemetryEvent measurement = TelemetryEvent.of(resolved, EventKind.MEASUREMENT,
                measurementPayload(elapsed, slaThreshold, violation, snapshot));
        CompletableFuture<DeliveryOutcome> measurementDelivery = client.sendAsync(measurement);

        CompletableFuture<List<DeliveryOutcome>> delivery;
        if (violation) {
            metrics.incrementSlaViolation(resolved);
            TelemetryEvent alert = raiseAlert(resolved, elapsed, slaThreshold);
            CompletableFuture<DeliveryOutcome> alertDelivery = measurementDelivery
                    .handle((outcome, error) -> null)
                    .thenCompose(ignored -> client.sendAsync(alert));
            delivery = measurementDelivery.thenCombine(alertDelivery, List::of);
        } else {
            delivery = measurementDelivery.thenApply(List::of);
        }
        delivery.whenComplete((outcomes, error) -> {
            if (error != null) {
                LOG.error("Telemetry for channel {} could not be delivered or stored: {}",
                        resolved, error.getMessage());
            } else {
                LOG.debug("Telemetry for channel {} settled: {}", resolved, outcomes);
            }
        });
        return new RecordedMeasurement(resolved, elapsed, slaThreshold, violation, delivery);
    }

    /**
     * Mean response time per channel in seconds, rounded to two decimals; 0 for channels without
     * measurements.
     */
    public Map<String, Double> averages() {
        Map<String, Double> result = new LinkedHashMap<>();
        statistics.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> result.put(e.getKey(), round2(e.getValue().snapshot().mean())));
        return result;
    }

    /**
     * Current aggregates for one channel, or an empty snapshot if it has no measurements.
     */
    public ChannelStatistics.Snapshot statistics(String channel) {
        ChannelStatistics stats = statistics.get(normalize(channel));
        return stats == null ? new ChannelStatistics().snapshot() : stats.snapshot();
    }

    private TelemetryEvent raiseAlert(String channel, Duration elapsed, Duration threshold) {
        String message = String.format(Locale.ROOT,
                "Response time of %.2fs on channel '%s' exceeds the SLA of %.2fs",
                TimeUtils.toSeconds(elapsed), channel, TimeUtils.toSeconds(threshold));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("elapsed_seconds", TimeUtils.toSeconds(elapsed));
        payload.put("sla_threshold_seconds", TimeUtils.toSeconds(threshold));
        payload.put("message", message);
        TelemetryEvent alert = TelemetryEvent.of(channel, EventKind.ALERT, payload);
        LOG.warn("ALERT: {}", message);
        alertJournal.append(alert);
        return alert;
    }

    private static Map<String, Object> measurementPayload(Duration elapsed, Duration threshold,
                                                          boolean violation, ChannelStatistics.Snapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("elapsed_seconds", TimeUtils.toSeconds(elapsed));
        payload.put("above_sla", violation);
        payload.put("sla_threshold_seconds", TimeUtils.toSeconds(threshold));
        payload.put("version", IngestClient.VERSION);
        payload.put("channel_metrics", snapshot.toPayload());
        return payload;
    }

    private String resolveChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new InvalidMeasurementException("Channel must not be blank");
        }
        String normalized = normalize(channel);
        if (OTHER_CHANNEL.equals(normalized) || knownChannels.contains(normalized)) {
            return normalized;
        }
        LOG.warn("Channel '{}' is not recognized; recording it as '{}'", channel, OTHER_CHANNEL);
        return OTHER_CHANNEL;
    }

    private static String normalize(String channel) {
        return channel.trim().toLowerCase(Locale.ROOT);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
