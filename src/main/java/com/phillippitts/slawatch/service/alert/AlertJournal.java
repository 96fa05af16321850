package com.phillippitts.slawatch.service.alert;

import com.phillippitts.slawatch.domain.EventKind;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

/**
 * Append-only operator log of SLA alerts, one JSON object per line.
 *
 * <p>Written through the dedicated {@value #LOGGER_NAME} logger, which log4j2-spring.xml routes to
 * its own file independent of the application log and of backlog rotation.
 */
public class AlertJournal {

    public static final String LOGGER_NAME = "slawatch.alerts";

    private static final Logger ALERTS = LogManager.getLogger(LOGGER_NAME);

    /**
     * Records an ALERT event. Other kinds are ignored.
     */
    public void append(TelemetryEvent alert) {
        if (alert.kind() != EventKind.ALERT) {
            return;
        }
        JSONObject line = new JSONObject();
        line.put("timestamp", alert.timestamp().toString());
        line.put("id", alert.id());
        line.put("channel", alert.channel());
        alert.payload().forEach(line::put);
        ALERTS.warn(line.toString());
    }
}
