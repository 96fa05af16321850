package com.phillippitts.slawatch.service.telemetry;

import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import com.phillippitts.slawatch.domain.DeliveryOutcome;
import com.phillippitts.slawatch.domain.LocalRecord;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.exception.IngestException;
import com.phillippitts.slawatch.exception.LocalStorageException;
import com.phillippitts.slawatch.service.backlog.LocalStore;
import com.phillippitts.slawatch.service.ingest.IngestClient;
import com.phillippitts.slawatch.service.metrics.TelemetryMetrics;
import com.phillippitts.slawatch.service.telemetry.breaker.BreakerSnapshot;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitBreaker;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitState;
import com.phillippitts.slawatch.service.telemetry.event.IngestRejectedEvent;
import com.phillippitts.slawatch.service.telemetry.event.LocalStorageFailureEvent;
import com.phillippitts.slawatch.service.telemetry.retry.RetryPolicy;
import com.phillippitts.slawatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Ships telemetry events to the remote backend, degrading to the local backlog when the backend is
 * unavailable and draining the backlog once it recovers.
 *
 * <p><b>Send algorithm:</b>
 * <ol>
 *   <li>Breaker refuses → the event is queued locally ({@link DeliveryOutcome#QUEUED}).</li>
 *   <li>Otherwise up to {@code retryPolicy.maxAttempts() + 1} remote attempts, each bounded by the
 *       remote timeout. Every failed attempt is reported to the breaker; the breaker is consulted
 *       again before each retry.</li>
 *   <li>Success → {@link DeliveryOutcome#DELIVERED}. Retries exhausted → queued.</li>
 *   <li>AUTH and VALIDATION rejections are not retried and leave the breaker untouched
 *       ({@link DeliveryOutcome#REJECTED}); AUTH-rejected events are still kept in the backlog.</li>
 * </ol>
 *
 * <p><b>Concurrency:</b> remote attempts run on the telemetry executor; backoff waits are
 * scheduled continuations on the task scheduler, so a waiting send holds no thread and no lock.
 *
 * <p><b>Errors:</b> remote unavailability is never an error for callers. A backlog write failure
 * is: the send completes exceptionally with {@link LocalStorageException}, and the event is kept
 * in a bounded in-memory buffer and retried on later queue operations and resync cycles.
 *
 * <p><b>Shutdown:</b> {@link #close()} stops retries, queues every event waiting for a retry,
 * waits up to the shutdown grace period for in-flight attempts, then queues whatever is left.
 */
public class TelemetryClient implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TelemetryClient.class);

    static final String REASON_CIRCUIT_OPEN = "circuit-open";
    static final String REASON_RETRIES_EXHAUSTED = "retries-exhausted";
    static final String REASON_AUTH_REJECTED = "auth-rejected";
    static final String REASON_SHUTDOWN = "shutdown";

    private final IngestClient ingestClient;
    private final CircuitBreaker breaker;
    private final RetryPolicy retryPolicy;
    private final LocalStore store;
    private final Executor attemptExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final TelemetryMetrics metrics;

    private final Duration remoteTimeout;
    private final Duration shutdownGrace;
    private final int resyncBatchLimit;
    private final int maxWriteAttempts;
    private final int memoryBufferCapacity;

    private final Set<PendingSend> active = ConcurrentHashMap.newKeySet();
    private final Deque<BufferedWrite> bufferedWrites = new ArrayDeque<>();
    private final AtomicBoolean resyncRunning = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    public TelemetryClient(IngestClient ingestClient,
                           CircuitBreaker breaker,
                           RetryPolicy retryPolicy,
                           LocalStore store,
                           TelemetryProperties props,
                           Executor attemptExecutor,
                           TaskScheduler scheduler,
                           ApplicationEventPublisher publisher,
                           TelemetryMetrics metrics) {
        this.ingestClient = Objects.requireNonNull(ingestClient, "ingestClient");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.store = Objects.requireNonNull(store, "store");
        this.attemptExecutor = Objects.requireNonNull(attemptExecutor, "attemptExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(props, "props");
        this.remoteTimeout = props.getRemoteTimeout();
        this.shutdownGrace = props.getShutdownGrace();
        this.resyncBatchLimit = props.getResyncBatchLimit();
        this.maxWriteAttempts = props.getStore().getMaxWriteAttempts();
        this.memoryBufferCapacity = props.getStore().getMemoryBufferCapacity();
        LOG.info("Telemetry client initialized (remoteTimeout={}, maxRetries={}, resyncBatchLimit={})",
                remoteTimeout, retryPolicy.maxAttempts(), resyncBatchLimit);
    }

    /**
     * Sends an event and waits for its final outcome.
     *
     * @return delivered, queued or rejected; never fails because the backend is unavailable
     * @throws LocalStorageException if the event had to be queued and the backlog could not store it
     */
    public DeliveryOutcome send(TelemetryEvent event) {
        try {
            return sendAsync(event).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    /**
     * Starts sending an event. The returned future completes with the final outcome, or
     * exceptionally with {@link LocalStorageException} when queuing failed.
     */
    public CompletableFuture<DeliveryOutcome> sendAsync(TelemetryEvent event) {
        Objects.requireNonNull(event, "event");
        PendingSend pending = new PendingSend(event);
        active.add(pending);
        if (shuttingDown.get()) {
            queueAndSettle(pending, 0, REASON_SHUTDOWN);
        } else if (!breaker.allow()) {
            LOG.debug("Circuit open; queuing event {} without a remote attempt", event.id());
            queueAndSettle(pending, 0, REASON_CIRCUIT_OPEN);
        } else {
            attempt(pending, 1);
        }
        return pending.result;
    }

    /**
     * Drains the backlog in stored order, one remote attempt per record, stopping at the first
     * failure so that order is preserved. Only one resync runs at a time; a concurrent call
     * returns a skipped report.
     *
     * @throws LocalStorageException if the backlog cannot be read or updated
     */
    public ResyncReport resync() {
        if (!resyncRunning.compareAndSet(false, true)) {
            LOG.debug("Resync already in progress; skipping");
            return ResyncReport.skipped(backlogSize());
        }
        try {
            flushBufferedWrites();
            int delivered = 0;
            int discarded = 0;
            String stopReason = null;
            try (Stream<LocalRecord> backlog = store.scanUnsynced()) {
                Iterator<LocalRecord> records = backlog.iterator();
                while (records.hasNext()) {
                    if (delivered + discarded >= resyncBatchLimit) {
                        stopReason = "batch-limit";
                        break;
                    }
                    if (shuttingDown.get()) {
                        stopReason = REASON_SHUTDOWN;
                        break;
                    }
                    if (!breaker.allow()) {
                        stopReason = REASON_CIRCUIT_OPEN;
                        break;
                    }
                    LocalRecord record = records.next();
                    Throwable failure = remoteAttempt(record.event())
                            .handle((ok, error) -> error == null ? null : unwrap(error))
                            .join();
                    if (failure == null) {
                        breaker.recordSuccess();
                        store.markSynced(record.id());
                        delivered++;
                        continue;
                    }
                    if (failure instanceof IngestException ie && !ie.isRetriable()) {
                        breaker.releaseTrial();
                        publishRejection(record.event(), ie);
                        if (ie.getKind() == IngestException.Kind.VALIDATION) {
                            LOG.error("Backlog record {} rejected as invalid by the backend; discarding it: {}",
                                    record.id(), ie.getMessage());
                            store.markSynced(record.id());
                            discarded++;
                            continue;
                        }
                        stopReason = REASON_AUTH_REJECTED;
                        break;
                    }
                    breaker.recordFailure();
                    metrics.incrementAttemptFailure(failureTag(failure));
                    LOG.warn("Resync of record {} failed; stopping this cycle: {}", record.id(), describe(failure));
                    stopReason = "remote-failure";
                    break;
                }
            }
            int remaining = backlogSize();
            if (delivered > 0 || discarded > 0) {
                LOG.info("Resync delivered {} backlog records (discarded={}, remaining={})",
                        delivered, discarded, remaining);
            } else {
                LOG.debug("Resync delivered nothing (remaining={}, stopReason={})", remaining, stopReason);
            }
            return new ResyncReport(delivered, discarded, remaining, remaining == 0 ? null : stopReason, false);
        } finally {
            resyncRunning.set(false);
        }
    }

    /**
     * Probes the backend once, bounded by the remote timeout. The probe does not affect the breaker.
     */
    public IngestHealth healthCheck() {
        long start = System.nanoTime();
        Throwable failure = CompletableFuture.runAsync(ingestClient::probe, attemptExecutor)
                .orTimeout(remoteTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ok, error) -> error == null ? null : unwrap(error))
                .join();
        Duration latency = Duration.ofMillis(TimeUtils.elapsedMillis(start));
        BreakerSnapshot snapshot = breaker.snapshot();
        return new IngestHealth(
                failure == null,
                latency,
                failure == null ? null : describe(failure),
                snapshot.state(),
                snapshot.failureCount(),
                backlogSize(),
                IngestClient.VERSION,
                IngestClient.API_VERSION,
                IngestClient.PROTOCOL);
    }

    /**
     * Events awaiting resync: persisted unsynced records plus events buffered in memory after a
     * backlog write failure.
     */
    public int backlogSize() {
        int buffered;
        synchronized (bufferedWrites) {
            buffered = bufferedWrites.size();
        }
        return store.unsyncedCount() + buffered;
    }

    public BreakerSnapshot breakerSnapshot() {
        return breaker.snapshot();
    }

    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Telemetry client shutting down ({} sends in progress)", active.size());

        for (PendingSend pending : List.copyOf(active)) {
            ScheduledFuture<?> retry = pending.retryTask;
            if (retry != null && retry.cancel(false)) {
                queueAndSettle(pending, pending.attempts, REASON_SHUTDOWN);
            }
        }

        List<PendingSend> inFlight = List.copyOf(active);
        if (!inFlight.isEmpty()) {
            CompletableFuture<?>[] results = inFlight.stream()
                    .map(p -> p.result)
                    .toArray(CompletableFuture[]::new);
            try {
                CompletableFuture.allOf(results).get(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                LOG.warn("In-flight sends did not finish within {}; queuing them", shutdownGrace);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for in-flight sends; queuing them");
            } catch (ExecutionException e) {
                LOG.error("A send failed during shutdown: {}", e.getCause().toString());
            }
        }
        for (PendingSend pending : List.copyOf(active)) {
            queueAndSettle(pending, pending.attempts, REASON_SHUTDOWN);
        }
        flushBufferedWrites();
        int lost;
        synchronized (bufferedWrites) {
            lost = bufferedWrites.size();
        }
        if (lost > 0) {
            LOG.fatal("{} telemetry events could not be written to the backlog before shutdown and are lost", lost);
        }
        LOG.info("Telemetry client stopped (backlog={})", store.unsyncedCount());
    }

    private void attempt(PendingSend pending, int attemptNo) {
        pending.attempts = attemptNo;
        remoteAttempt(pending.event).whenCompleteAsync((ok, error) -> {
            try {
                onAttemptComplete(pending, attemptNo, error);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error while completing send of event {}", pending.event.id(), e);
                if (pending.claim()) {
                    active.remove(pending);
                    pending.result.completeExceptionally(e);
                }
            }
        }, attemptExecutor);
    }

    private CompletableFuture<Void> remoteAttempt(TelemetryEvent event) {
        return CompletableFuture.runAsync(() -> ingestClient.ingest(event), attemptExecutor)
                .orTimeout(remoteTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onAttemptComplete(PendingSend pending, int attemptNo, Throwable error) {
        TelemetryEvent event = pending.event;
        if (error == null) {
            breaker.recordSuccess();
            pending.delivered = true;
            if (pending.claim()) {
                LOG.debug("Event {} delivered on attempt {}", event.id(), attemptNo);
                settle(pending, DeliveryOutcome.DELIVERED);
            } else {
                // already queued by close(); the backlog copy must not be resent
                markDeliveredAfterQueue(pending);
            }
            return;
        }

        Throwable cause = unwrap(error);
        if (cause instanceof IngestException ie && !ie.isRetriable()) {
            breaker.releaseTrial();
            handleRejection(pending, attemptNo, ie);
            return;
        }

        breaker.recordFailure();
        metrics.incrementAttemptFailure(failureTag(cause));
        int maxTries = retryPolicy.maxAttempts() + 1;
        LOG.warn("Remote attempt {}/{} for event {} (channel={}) failed: {}",
                attemptNo, maxTries, event.id(), event.channel(), describe(cause));

        if (attemptNo >= maxTries) {
            queueAndSettle(pending, attemptNo, REASON_RETRIES_EXHAUSTED);
        } else if (breaker.getState() == CircuitState.OPEN) {
            LOG.debug("Circuit opened after attempt {} for event {}; queuing it", attemptNo, event.id());
            queueAndSettle(pending, attemptNo, REASON_CIRCUIT_OPEN);
        } else if (shuttingDown.get()) {
            queueAndSettle(pending, attemptNo, REASON_SHUTDOWN);
        } else {
            scheduleRetry(pending, attemptNo);
        }
    }

    private void scheduleRetry(PendingSend pending, int failedAttempt) {
        Duration delay = retryPolicy.nextDelay(failedAttempt);
        try {
            pending.retryTask = scheduler.schedule(() -> retry(pending, failedAttempt + 1), Instant.now().plus(delay));
        } catch (TaskRejectedException e) {
            LOG.warn("Retry scheduler unavailable; queuing event {}", pending.event.id());
            queueAndSettle(pending, failedAttempt, REASON_SHUTDOWN);
            return;
        }
        LOG.debug("Retrying event {} in {}", pending.event.id(), delay);
        // close() may have run between the shutdown check and scheduling
        if (shuttingDown.get() && pending.retryTask.cancel(false)) {
            queueAndSettle(pending, failedAttempt, REASON_SHUTDOWN);
        }
    }

    private void retry(PendingSend pending, int attemptNo) {
        pending.retryTask = null;
        if (shuttingDown.get()) {
            queueAndSettle(pending, attemptNo - 1, REASON_SHUTDOWN);
        } else if (!breaker.allow()) {
            LOG.debug("Circuit opened while event {} was waiting to retry; queuing it", pending.event.id());
            queueAndSettle(pending, attemptNo - 1, REASON_CIRCUIT_OPEN);
        } else {
            attempt(pending, attemptNo);
        }
    }

    private void handleRejection(PendingSend pending, int attemptNo, IngestException e) {
        TelemetryEvent event = pending.event;
        publishRejection(event, e);
        if (!pending.claim()) {
            return;
        }
        if (e.getKind() == IngestException.Kind.AUTH) {
            LOG.error("Event {} rejected by the backend (authentication); keeping it in the backlog", event.id());
            try {
                queue(event, attemptNo, REASON_AUTH_REJECTED);
            } catch (LocalStorageException storageFailure) {
                active.remove(pending);
                pending.result.completeExceptionally(storageFailure);
                return;
            }
        } else {
            LOG.error("Event {} rejected by the backend as invalid; dropping it: {}", event.id(), e.getMessage());
        }
        settle(pending, DeliveryOutcome.REJECTED);
    }

    private void queueAndSettle(PendingSend pending, int attempts, String reason) {
        if (!pending.claim()) {
            return;
        }
        try {
            queue(pending.event, attempts, reason);
        } catch (LocalStorageException e) {
            active.remove(pending);
            pending.result.completeExceptionally(e);
            return;
        }
        if (pending.delivered) {
            markDeliveredAfterQueue(pending);
        }
        settle(pending, DeliveryOutcome.QUEUED);
    }

    /**
     * Tombstones an event that was queued at shutdown while its last attempt was still in flight
     * and that attempt then succeeded. Either side may get here first; marking an id the backlog
     * does not hold yet is a no-op, so both sides call it.
     */
    private void markDeliveredAfterQueue(PendingSend pending) {
        try {
            store.markSynced(pending.event.id());
            LOG.info("Event {} was delivered after being queued at shutdown; marked synced", pending.event.id());
        } catch (LocalStorageException e) {
            LOG.warn("Could not mark late-delivered event {} as synced; it will be resent: {}",
                    pending.event.id(), e.getMessage());
        }
    }

    private void settle(PendingSend pending, DeliveryOutcome outcome) {
        active.remove(pending);
        metrics.recordDelivery(outcome);
        pending.result.complete(outcome);
    }

    private void queue(TelemetryEvent event, int attempts, String reason) {
        flushBufferedWrites();
        LocalRecord record = LocalRecord.unsynced(event, attempts, reason);
        try {
            store.append(record);
        } catch (LocalStorageException e) {
            bufferAfterWriteFailure(record, e);
            throw e;
        }
        LOG.info("Event {} queued to backlog (channel={}, kind={}, reason={}, attempts={})",
                event.id(), event.channel(), event.kind(), reason, attempts);
    }

    private void bufferAfterWriteFailure(LocalRecord record, LocalStorageException e) {
        LOG.error("CRITICAL: could not write event {} to the backlog: {}", record.id(), e.getMessage());
        boolean dropped;
        synchronized (bufferedWrites) {
            dropped = maxWriteAttempts <= 1 || bufferedWrites.size() >= memoryBufferCapacity;
            if (!dropped) {
                bufferedWrites.addLast(new BufferedWrite(record, 1));
            }
        }
        if (dropped) {
            LOG.fatal("Telemetry event {} (channel={}) dropped: backlog unwritable and no retry capacity left",
                    record.id(), record.event().channel());
        }
        publisher.publishEvent(new LocalStorageFailureEvent(record.id(), e.getLocation(), dropped, Instant.now()));
    }

    /**
     * Retries events buffered after a backlog write failure, oldest first, stopping at the first
     * write that still fails.
     */
    private void flushBufferedWrites() {
        List<LocalRecord> droppedRecords = new ArrayList<>();
        synchronized (bufferedWrites) {
            while (!bufferedWrites.isEmpty()) {
                BufferedWrite next = bufferedWrites.peekFirst();
                try {
                    store.append(next.record);
                    bufferedWrites.removeFirst();
                    LOG.info("Buffered event {} written to backlog after {} failed attempts",
                            next.record.id(), next.attempts);
                } catch (LocalStorageException e) {
                    next.attempts++;
                    if (next.attempts >= maxWriteAttempts) {
                        bufferedWrites.removeFirst();
                        droppedRecords.add(next.record);
                    }
                    break;
                }
            }
        }
        for (LocalRecord record : droppedRecords) {
            LOG.fatal("Telemetry event {} (channel={}) dropped after {} failed backlog writes",
                    record.id(), record.event().channel(), maxWriteAttempts);
            publisher.publishEvent(new LocalStorageFailureEvent(record.id(), "backlog", true, Instant.now()));
        }
    }

    private void publishRejection(TelemetryEvent event, IngestException e) {
        publisher.publishEvent(new IngestRejectedEvent(event.id(), event.channel(), e.getKind(),
                e.getMessage(), Instant.now()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String describe(Throwable failure) {
        if (failure instanceof TimeoutException) {
            return "timed out after " + remoteTimeout;
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.toString();
    }

    private static String failureTag(Throwable failure) {
        if (failure instanceof IngestException ie) {
            return TelemetryMetrics.kindTag(ie.getKind());
        }
        return failure instanceof TimeoutException ? "timeout" : "unknown";
    }

    /** One send in progress. Exactly one party settles it. */
    private static final class PendingSend {
        private final TelemetryEvent event;
        private final CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
        private volatile int attempts;
        private volatile ScheduledFuture<?> retryTask;
        private volatile boolean delivered;

        private PendingSend(TelemetryEvent event) {
            this.event = event;
        }

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }

    private static final class BufferedWrite {
        private final LocalRecord record;
        private int attempts;

        private BufferedWrite(LocalRecord record, int attempts) {
            this.record = record;
            this.attempts = attempts;
        }
    }
}
