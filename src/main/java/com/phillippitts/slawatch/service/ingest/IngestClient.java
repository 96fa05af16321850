package com.phillippitts.slawatch.service.ingest;

import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.exception.IngestException;

/**
 * Minimal transport SPI: deliver telemetry events to the remote ingestion backend.
 *
 * <p>Implementations block until the backend acknowledges or refuses the call; callers bound the
 * wait with their own timeout. Implementations must be thread-safe.
 */
public interface IngestClient {

    String VERSION = "1.0.0";
    String API_VERSION = "v1";
    String PROTOCOL = "TLS 1.2";

    /**
     * Delivers one event.
     *
     * @throws IngestException if the backend did not acknowledge the event
     */
    void ingest(TelemetryEvent event);

    /**
     * Sends a health-check payload that is not a telemetry event.
     *
     * @throws IngestException if the backend did not acknowledge the probe
     */
    void probe();
}
