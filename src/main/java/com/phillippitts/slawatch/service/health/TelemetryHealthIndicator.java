package com.phillippitts.slawatch.service.health;

import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import com.phillippitts.slawatch.service.telemetry.breaker.BreakerSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for telemetry shipping.
 *
 * <p>Reports shipping health for monitoring and alerting:
 * <ul>
 *   <li>UP: circuit closed and backlog empty</li>
 *   <li>DEGRADED: circuit half-open, or events still waiting in the backlog</li>
 *   <li>DOWN: circuit open; events are being queued locally</li>
 * </ul>
 *
 * <p>Uses local state only; it never calls the remote backend. Exposed via /actuator/health.
 */
@Component("telemetry")
public class TelemetryHealthIndicator implements HealthIndicator {

    private final TelemetryClient client;

    public TelemetryHealthIndicator(TelemetryClient client) {
        this.client = client;
    }

    @Override
    public Health health() {
        BreakerSnapshot breaker = client.breakerSnapshot();
        int backlog = client.backlogSize();

        Health.Builder builder = switch (breaker.state()) {
            case OPEN -> Health.down().withDetail("status", "Remote backend unavailable; queuing locally");
            case HALF_OPEN -> Health.status("DEGRADED").withDetail("status", "Probing remote backend");
            case CLOSED -> backlog > 0
                    ? Health.status("DEGRADED").withDetail("status", "Backlog awaiting resync")
                    : Health.up().withDetail("status", "Shipping normally");
        };
        builder.withDetail("circuitState", breaker.state().name())
                .withDetail("failureCount", breaker.failureCount())
                .withDetail("backlogSize", backlog);
        if (breaker.openedAt() != null) {
            builder.withDetail("openedAt", breaker.openedAt().toString())
                    .withDetail("cooldown", breaker.cooldown().toString());
        }
        return builder.build();
    }
}
