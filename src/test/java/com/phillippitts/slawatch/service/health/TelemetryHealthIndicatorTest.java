package com.phillippitts.slawatch.service.health;

import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import com.phillippitts.slawatch.service.telemetry.breaker.BreakerSnapshot;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelemetryHealthIndicatorTest {

    private TelemetryClient client;
    private TelemetryHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        client = mock(TelemetryClient.class);
        indicator = new TelemetryHealthIndicator(client);
    }

    @Test
    void shouldReportUpWhenClosedAndBacklogEmpty() {
        when(client.breakerSnapshot()).thenReturn(closed());
        when(client.backlogSize()).thenReturn(0);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("circuitState", "CLOSED");
        assertThat(health.getDetails()).containsEntry("backlogSize", 0);
        assertThat(health.getDetails()).doesNotContainKey("openedAt");
    }

    @Test
    void shouldReportDegradedWhileBacklogAwaitsResync() {
        when(client.breakerSnapshot()).thenReturn(closed());
        when(client.backlogSize()).thenReturn(12);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Backlog awaiting resync");
        assertThat(health.getDetails()).containsEntry("backlogSize", 12);
    }

    @Test
    void shouldReportDegradedWhenHalfOpen() {
        when(client.breakerSnapshot()).thenReturn(new BreakerSnapshot(CircuitState.HALF_OPEN, 3,
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z"), Duration.ofSeconds(8)));

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDownWhenOpen() {
        Instant openedAt = Instant.parse("2026-01-01T00:00:00Z");
        when(client.breakerSnapshot()).thenReturn(new BreakerSnapshot(CircuitState.OPEN, 3, openedAt, openedAt,
                Duration.ofSeconds(16)));
        when(client.backlogSize()).thenReturn(4);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("failureCount", 3);
        assertThat(health.getDetails()).containsEntry("openedAt", "2026-01-01T00:00:00Z");
        assertThat(health.getDetails()).containsEntry("cooldown", "PT16S");
    }

    private static BreakerSnapshot closed() {
        return new BreakerSnapshot(CircuitState.CLOSED, 0, null, null, Duration.ofSeconds(8));
    }
}
