package com.phillippitts.slawatch.service.telemetry;

import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import com.phillippitts.slawatch.exception.SlaWatchException;
import com.phillippitts.slawatch.service.backlog.LocalStore;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitStateChangedEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives backlog reconciliation: a fixed-delay resync cycle plus an immediate cycle whenever the
 * circuit breaker recovers. Expired backlog segments are purged after each periodic cycle.
 *
 * <p>Recovery-triggered cycles are handed to the scheduler rather than run on the publishing
 * thread, which may itself be inside a send or a resync.
 */
public class BacklogResyncScheduler {

    private static final Logger LOG = LogManager.getLogger(BacklogResyncScheduler.class);

    private final TelemetryClient client;
    private final LocalStore store;
    private final TaskScheduler scheduler;
    private final Duration interval;

    private volatile ScheduledFuture<?> periodic;

    public BacklogResyncScheduler(TelemetryClient client,
                                  LocalStore store,
                                  TaskScheduler scheduler,
                                  TelemetryProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(props, "props").getResyncInterval();
    }

    @PostConstruct
    public void start() {
        periodic = scheduler.scheduleWithFixedDelay(this::runPeriodic, interval);
        LOG.info("Backlog resync scheduled every {}", interval);
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task = periodic;
        if (task != null) {
            task.cancel(false);
        }
    }

    @EventListener
    public void onCircuitStateChanged(CircuitStateChangedEvent event) {
        if (!event.isRecovery()) {
            return;
        }
        LOG.info("Remote backend recovered ({} -> {}); starting backlog resync", event.from(), event.to());
        try {
            scheduler.schedule(this::runResync, Instant.now());
        } catch (TaskRejectedException e) {
            LOG.debug("Scheduler unavailable; recovery resync skipped: {}", e.getMessage());
        }
    }

    void runPeriodic() {
        runResync();
        try {
            store.purgeExpired();
        } catch (SlaWatchException e) {
            LOG.error("Backlog retention purge failed: {}", e.getMessage());
        }
    }

    void runResync() {
        try {
            ResyncReport report = client.resync();
            if (!report.skipped() && report.remaining() > 0) {
                LOG.debug("Backlog still holds {} records (stopReason={})", report.remaining(), report.stopReason());
            }
        } catch (SlaWatchException e) {
            LOG.error("CRITICAL: backlog resync failed: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            // Keep the periodic task alive; an escaping exception cancels it
            LOG.error("Unexpected error during backlog resync", e);
        }
    }
}
