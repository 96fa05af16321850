package com.phillippitts.slawatch.service.health;

import com.phillippitts.slawatch.service.telemetry.IngestHealth;
import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Verifies the remote ingestion integration once the application is ready and logs the result.
 * A failed check never stops the application; telemetry degrades to the local backlog.
 */
@Component
@ConditionalOnProperty(prefix = "slawatch.ingest", name = "verify-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupIntegrationCheck {

    private static final Logger LOG = LogManager.getLogger(StartupIntegrationCheck.class);

    private final TelemetryClient client;

    public StartupIntegrationCheck(TelemetryClient client) {
        this.client = client;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verify() {
        try {
            IngestHealth health = client.healthCheck();
            if (health.healthy()) {
                LOG.info("Telemetry integration OK (latency={}ms, version={}, api={}, protocol={})",
                        health.latency().toMillis(), health.version(), health.apiVersion(), health.protocol());
            } else {
                LOG.warn("Telemetry integration unhealthy: {} (backlog={})", health.error(), health.backlogSize());
            }
        } catch (RuntimeException e) {
            LOG.error("Could not verify telemetry integration: {}", e.toString());
        }
    }
}
