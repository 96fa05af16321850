package com.phillippitts.slawatch.presentation.controller;

import com.phillippitts.slawatch.service.telemetry.IngestHealth;
import com.phillippitts.slawatch.service.telemetry.ResyncReport;
import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the telemetry integration: probe the backend and drain the backlog on demand.
 */
@RestController
@RequestMapping("/api/telemetry")
class TelemetryController {

    private static final Logger LOG = LogManager.getLogger(TelemetryController.class);

    private final TelemetryClient client;

    TelemetryController(TelemetryClient client) {
        this.client = client;
    }

    @GetMapping("/health")
    ResponseEntity<IngestHealth> health() {
        IngestHealth health = client.healthCheck();
        HttpStatus status = health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @PostMapping("/resync")
    ResponseEntity<ResyncReport> resync() {
        LOG.info("Manual backlog resync requested");
        return ResponseEntity.ok(client.resync());
    }
}
