package com.phillippitts.slawatch.service.alert;

import com.phillippitts.slawatch.domain.EventKind;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.testutil.InMemoryAppender;
import org.apache.logging.log4j.Level;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertJournalTest {

    private InMemoryAppender appender;
    private final AlertJournal journal = new AlertJournal();

    @BeforeEach
    void setUp() {
        appender = InMemoryAppender.attachTo(AlertJournal.LOGGER_NAME);
    }

    @AfterEach
    void tearDown() {
        appender.close();
    }

    @Test
    void writesOneJsonLinePerAlert() {
        journal.append(new TelemetryEvent("alert-1", "chat", EventKind.ALERT, Instant.parse("2026-07-01T10:00:00Z"),
                Map.of("message", "too slow", "elapsed_seconds", 6.5)));

        assertThat(appender.messagesAt(Level.WARN)).singleElement().satisfies(line -> {
            JSONObject json = new JSONObject(line);
            assertThat(json.getString("id")).isEqualTo("alert-1");
            assertThat(json.getString("channel")).isEqualTo("chat");
            assertThat(json.getString("timestamp")).isEqualTo("2026-07-01T10:00:00Z");
            assertThat(json.getString("message")).isEqualTo("too slow");
            assertThat(json.getDouble("elapsed_seconds")).isEqualTo(6.5);
        });
    }

    @Test
    void ignoresMeasurements() {
        journal.append(TelemetryEvent.of("chat", EventKind.MEASUREMENT, Map.of("elapsed_seconds", 1.0)));

        assertThat(appender.getEvents()).isEmpty();
    }
}
