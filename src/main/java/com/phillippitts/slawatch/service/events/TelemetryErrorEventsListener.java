package com.phillippitts.slawatch.service.events;

import com.phillippitts.slawatch.exception.IngestException;
import com.phillippitts.slawatch.service.telemetry.event.IngestRejectedEvent;
import com.phillippitts.slawatch.service.telemetry.event.LocalStorageFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing handler for telemetry error events. Throttled per condition to avoid log spam
 * while a credential or disk problem persists.
 */
@Component
class TelemetryErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(TelemetryErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    TelemetryErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onIngestRejected(IngestRejectedEvent e) {
        if (e.kind() == IngestException.Kind.AUTH) {
            if (shouldLog("ingest-auth")) {
                LOG.error("Telemetry backend refused credentials. Check AXIOM_TOKEN and AXIOM_ORG_ID "
                        + "(slawatch.ingest.token / org-id); events are kept in the backlog until then.");
            }
        } else if (shouldLog("ingest-rejected-" + e.kind())) {
            LOG.error("Telemetry backend rejected event {} (channel={}, kind={}): {}",
                    e.eventId(), e.channel(), e.kind(), e.message());
        }
    }

    @EventListener
    void onLocalStorageFailure(LocalStorageFailureEvent e) {
        String key = "storage-" + e.location();
        if (shouldLog(key)) {
            LOG.error("CRITICAL: telemetry backlog not writable at {}. Check disk space and permissions "
                    + "for slawatch.telemetry.store.directory.", e.location());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
