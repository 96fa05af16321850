package com.phillippitts.slawatch.presentation.controller;

import com.phillippitts.slawatch.exception.InvalidMeasurementException;
import com.phillippitts.slawatch.service.metrics.MetricsCollector;
import com.phillippitts.slawatch.service.metrics.RecordedMeasurement;
import com.phillippitts.slawatch.util.TimeUtils;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts response-time measurements from support channels. Delivery to the telemetry backend
 * happens asynchronously; the request returns as soon as the measurement is recorded.
 */
@RestController
@RequestMapping("/api/response-times")
class ResponseTimeController {

    private static final Logger LOG = LogManager.getLogger(ResponseTimeController.class);

    private final MetricsCollector collector;

    ResponseTimeController(MetricsCollector collector) {
        this.collector = collector;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> record(@Valid @RequestBody ResponseTimeRequest request) {
        Duration elapsed = toDuration(request.elapsedSeconds(), "elapsedSeconds");
        RecordedMeasurement recorded = request.slaThresholdSeconds() == null
                ? collector.record(request.channel(), elapsed)
                : collector.record(request.channel(), elapsed,
                        toDuration(request.slaThresholdSeconds(), "slaThresholdSeconds"));
        LOG.debug("Recorded {}s on channel {} (aboveSla={})",
                request.elapsedSeconds(), recorded.channel(), recorded.aboveSla());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", recorded.channel());
        body.put("elapsedSeconds", TimeUtils.toSeconds(recorded.elapsed()));
        body.put("slaThresholdSeconds", TimeUtils.toSeconds(recorded.threshold()));
        body.put("aboveSla", recorded.aboveSla());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/averages")
    ResponseEntity<Map<String, Double>> averages() {
        return ResponseEntity.ok(collector.averages());
    }

    private static Duration toDuration(double seconds, String field) {
        try {
            return TimeUtils.fromSeconds(seconds);
        } catch (IllegalArgumentException e) {
            throw new InvalidMeasurementException(field + ": " + e.getMessage());
        }
    }

    record ResponseTimeRequest(
            @NotBlank String channel,
            @NotNull @PositiveOrZero Double elapsedSeconds,
            @PositiveOrZero Double slaThresholdSeconds
    ) {}
}
