package com.phillippitts.slawatch.service.telemetry;

import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import com.phillippitts.slawatch.domain.DeliveryOutcome;
import com.phillippitts.slawatch.domain.EventKind;
import com.phillippitts.slawatch.domain.LocalRecord;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.exception.IngestException;
import com.phillippitts.slawatch.exception.LocalStorageException;
import com.phillippitts.slawatch.service.metrics.TelemetryMetrics;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitBreaker;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitState;
import com.phillippitts.slawatch.service.telemetry.event.IngestRejectedEvent;
import com.phillippitts.slawatch.service.telemetry.event.LocalStorageFailureEvent;
import com.phillippitts.slawatch.service.telemetry.retry.ExponentialBackoffRetryPolicy;
import com.phillippitts.slawatch.service.telemetry.retry.RetryPolicy;
import com.phillippitts.slawatch.testutil.EventCapturingPublisher;
import com.phillippitts.slawatch.testutil.FakeIngestClient;
import com.phillippitts.slawatch.testutil.InMemoryLocalStore;
import com.phillippitts.slawatch.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TelemetryClientTest {

    private final FakeIngestClient backend = new FakeIngestClient();
    private final InMemoryLocalStore store = new InMemoryLocalStore();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private TelemetryProperties props;
    private ThreadPoolTaskScheduler scheduler;
    private ExecutorService pool;
    private CircuitBreaker breaker;
    private TelemetryClient client;

    @BeforeEach
    void setUp() {
        props = new TelemetryProperties();
        props.setShutdownGrace(Duration.ofMillis(500));
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("test-retry-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        scheduler.shutdown();
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void deliversWhenBackendAcknowledges() {
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());

        TelemetryEvent event = event();
        DeliveryOutcome outcome = client.send(event);

        assertThat(outcome).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(backend.deliveredIds()).containsExactly(event.id());
        assertThat(store.records()).isEmpty();
        assertThat(deliveryCount("delivered")).isEqualTo(1.0);
    }

    @Test
    void queuesWithoutRemoteCallWhenCircuitIsOpen() {
        props.getBreaker().setFailureThreshold(1);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        breaker.recordFailure();

        DeliveryOutcome outcome = client.send(event());

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(backend.ingestCalls()).isZero();
        assertThat(store.records()).singleElement().satisfies(r -> {
            assertThat(r.reason()).isEqualTo(TelemetryClient.REASON_CIRCUIT_OPEN);
            assertThat(r.attemptCount()).isZero();
        });
    }

    @Test
    void retriesThenQueuesExactlyOnceWhenRetriesAreExhausted() throws Exception {
        backend.failAlways(IngestException.Kind.SERVER);
        client = newClient(retries(Duration.ofMillis(10), 2), new SyncExecutor());

        DeliveryOutcome outcome = client.sendAsync(event()).get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(backend.ingestCalls()).isEqualTo(3);
        assertThat(store.records()).singleElement().satisfies(r -> {
            assertThat(r.reason()).isEqualTo(TelemetryClient.REASON_RETRIES_EXHAUSTED);
            assertThat(r.attemptCount()).isEqualTo(3);
            assertThat(r.synced()).isFalse();
        });
        assertThat(attemptFailures("server")).isEqualTo(3.0);
    }

    @Test
    void deliversOnRetryAfterTransientFailure() throws Exception {
        backend.failNext(1, IngestException.Kind.NETWORK);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());

        DeliveryOutcome outcome = client.sendAsync(event()).get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(backend.ingestCalls()).isEqualTo(2);
        assertThat(store.records()).isEmpty();
        assertThat(breaker.snapshot().failureCount()).isZero();
    }

    @Test
    void stopsRetryingOnceCircuitOpens() throws Exception {
        props.getBreaker().setFailureThreshold(2);
        backend.failAlways(IngestException.Kind.RATE_LIMIT);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());

        DeliveryOutcome outcome = client.sendAsync(event()).get(5, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(backend.ingestCalls()).isEqualTo(2);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(store.records()).singleElement()
                .extracting(LocalRecord::reason).isEqualTo(TelemetryClient.REASON_CIRCUIT_OPEN);
    }

    @Test
    void queuesAtOnceWhenFailureOpensCircuit() throws Exception {
        props.getBreaker().setFailureThreshold(1);
        backend.failAlways(IngestException.Kind.SERVER);
        client = newClient(retries(Duration.ofSeconds(30), 3), new SyncExecutor());

        DeliveryOutcome outcome = client.sendAsync(event()).get(2, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(backend.ingestCalls()).isEqualTo(1);
        assertThat(store.records()).singleElement().satisfies(r -> {
            assertThat(r.reason()).isEqualTo(TelemetryClient.REASON_CIRCUIT_OPEN);
            assertThat(r.attemptCount()).isEqualTo(1);
        });
    }

    @Test
    void authRejectionIsNotRetriedKeepsEventAndLeavesBreakerAlone() {
        backend.failAlways(IngestException.Kind.AUTH);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        TelemetryEvent event = event();

        DeliveryOutcome outcome = client.send(event);

        assertThat(outcome).isEqualTo(DeliveryOutcome.REJECTED);
        assertThat(backend.ingestCalls()).isEqualTo(1);
        assertThat(store.records()).singleElement()
                .extracting(LocalRecord::reason).isEqualTo(TelemetryClient.REASON_AUTH_REJECTED);
        assertThat(breaker.snapshot().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
        assertThat(publisher.eventsOf(IngestRejectedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.eventId()).isEqualTo(event.id());
            assertThat(e.kind()).isEqualTo(IngestException.Kind.AUTH);
        });
    }

    @Test
    void validationRejectionDropsEvent() {
        backend.failAlways(IngestException.Kind.VALIDATION);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());

        DeliveryOutcome outcome = client.send(event());

        assertThat(outcome).isEqualTo(DeliveryOutcome.REJECTED);
        assertThat(backend.ingestCalls()).isEqualTo(1);
        assertThat(store.records()).isEmpty();
        assertThat(breaker.snapshot().failureCount()).isZero();
        assertThat(deliveryCount("rejected")).isEqualTo(1.0);
    }

    @Test
    void slowBackendCountsAsTimedOutFailure() {
        pool = Executors.newFixedThreadPool(2);
        props.setRemoteTimeout(Duration.ofMillis(100));
        backend.respondAfter(Duration.ofSeconds(2));
        client = newClient(retries(Duration.ofMillis(10), 0), pool);

        DeliveryOutcome outcome = client.send(event());

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(1);
        assertThat(attemptFailures("timeout")).isEqualTo(1.0);
    }

    @Test
    void backlogWriteFailureSurfacesAndEventIsBufferedForLater() {
        props.getBreaker().setFailureThreshold(1);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        breaker.recordFailure();
        store.failWrites(true);
        TelemetryEvent event = event();

        assertThatThrownBy(() -> client.send(event)).isInstanceOf(LocalStorageException.class);
        assertThat(client.backlogSize()).isEqualTo(1);
        assertThat(publisher.eventsOf(LocalStorageFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.dropped()).isFalse());

        store.failWrites(false);
        client.resync();

        assertThat(store.unsyncedIds()).containsExactly(event.id());
        assertThat(client.backlogSize()).isEqualTo(1);
    }

    @Test
    void eventIsDroppedOnceWriteAttemptsAreUsedUp() {
        props.getBreaker().setFailureThreshold(1);
        props.getStore().setMaxWriteAttempts(1);
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        breaker.recordFailure();
        store.failWrites(true);

        assertThatThrownBy(() -> client.send(event())).isInstanceOf(LocalStorageException.class);

        assertThat(client.backlogSize()).isZero();
        assertThat(publisher.eventsOf(LocalStorageFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.dropped()).isTrue());
    }

    @Test
    void closeQueuesSendsWaitingForRetry() throws Exception {
        backend.failAlways(IngestException.Kind.SERVER);
        client = newClient(retries(Duration.ofSeconds(30), 3), new SyncExecutor());

        CompletableFuture<DeliveryOutcome> pending = client.sendAsync(event());
        assertThat(pending).isNotDone();

        client.close();

        assertThat(pending.get(1, TimeUnit.SECONDS)).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(store.records()).singleElement().satisfies(r -> {
            assertThat(r.reason()).isEqualTo(TelemetryClient.REASON_SHUTDOWN);
            assertThat(r.attemptCount()).isEqualTo(1);
        });
        assertThat(backend.ingestCalls()).isEqualTo(1);
    }

    @Test
    void closeWaitsForInFlightAttemptWithinGracePeriod() {
        pool = Executors.newFixedThreadPool(2);
        backend.respondAfter(Duration.ofMillis(150));
        client = newClient(retries(Duration.ofMillis(10), 0), pool);

        CompletableFuture<DeliveryOutcome> inFlight = client.sendAsync(event());
        await().atMost(Duration.ofSeconds(2)).until(() -> backend.ingestCalls() == 1);
        client.close();

        assertThat(inFlight).isCompletedWithValue(DeliveryOutcome.DELIVERED);
        assertThat(store.records()).isEmpty();
    }

    @Test
    void attemptSucceedingAfterGracePeriodLeavesNoUnsyncedCopy() throws Exception {
        props.setShutdownGrace(Duration.ofMillis(100));
        pool = Executors.newFixedThreadPool(2);
        backend.respondAfter(Duration.ofMillis(600));
        client = newClient(retries(Duration.ofMillis(10), 0), pool);
        TelemetryEvent event = event();

        CompletableFuture<DeliveryOutcome> inFlight = client.sendAsync(event);
        await().atMost(Duration.ofSeconds(2)).until(() -> backend.ingestCalls() == 1);
        client.close();

        assertThat(inFlight.get(1, TimeUnit.SECONDS)).isEqualTo(DeliveryOutcome.QUEUED);
        await().atMost(Duration.ofSeconds(3)).until(() -> backend.deliveredIds().contains(event.id()));
        await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertThat(store.unsyncedIds()).doesNotContain(event.id()));
        assertThat(store.records()).singleElement()
                .extracting(LocalRecord::reason).isEqualTo(TelemetryClient.REASON_SHUTDOWN);
    }

    @Test
    void sendAfterCloseGoesStraightToBacklog() {
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        client.close();

        DeliveryOutcome outcome = client.send(event());

        assertThat(outcome).isEqualTo(DeliveryOutcome.QUEUED);
        assertThat(backend.ingestCalls()).isZero();
        assertThat(store.records()).singleElement()
                .extracting(LocalRecord::reason).isEqualTo(TelemetryClient.REASON_SHUTDOWN);
    }

    @Test
    void healthCheckReportsBackendStateWithoutTouchingBreaker() {
        client = newClient(retries(Duration.ofMillis(10), 3), new SyncExecutor());
        IngestHealth healthy = client.healthCheck();

        backend.failAlways(IngestException.Kind.NETWORK);
        IngestHealth unhealthy = client.healthCheck();

        assertThat(healthy.healthy()).isTrue();
        assertThat(healthy.status()).isEqualTo("healthy");
        assertThat(unhealthy.healthy()).isFalse();
        assertThat(unhealthy.error()).contains("NETWORK");
        assertThat(unhealthy.breakerState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
        assertThat(backend.probeCalls()).isEqualTo(2);
    }

    private TelemetryClient newClient(RetryPolicy retryPolicy, Executor executor) {
        breaker = new CircuitBreaker(props.getBreaker(), Clock.systemUTC(), publisher);
        return new TelemetryClient(backend, breaker, retryPolicy, store, props, executor, scheduler,
                publisher, new TelemetryMetrics(registry));
    }

    private static RetryPolicy retries(Duration base, int maxRetries) {
        return new ExponentialBackoffRetryPolicy(base, maxRetries, 0.0);
    }

    private static TelemetryEvent event() {
        return TelemetryEvent.of("chat", EventKind.MEASUREMENT, Map.of("elapsed_seconds", 2.0));
    }

    private double deliveryCount(String outcome) {
        return registry.get("slawatch.telemetry.delivery").tag("outcome", outcome).counter().count();
    }

    private double attemptFailures(String kind) {
        return registry.get("slawatch.telemetry.attempt.failures").tag("kind", kind).counter().count();
    }
}
