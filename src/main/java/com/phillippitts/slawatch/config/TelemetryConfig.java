package com.phillippitts.slawatch.config;

import com.phillippitts.slawatch.config.properties.IngestProperties;
import com.phillippitts.slawatch.config.properties.SlaProperties;
import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import com.phillippitts.slawatch.service.alert.AlertJournal;
import com.phillippitts.slawatch.service.backlog.JsonLinesLocalStore;
import com.phillippitts.slawatch.service.backlog.LocalStore;
import com.phillippitts.slawatch.service.backlog.RotationPolicy;
import com.phillippitts.slawatch.service.ingest.HttpIngestClient;
import com.phillippitts.slawatch.service.ingest.IngestClient;
import com.phillippitts.slawatch.service.metrics.MetricsCollector;
import com.phillippitts.slawatch.service.metrics.TelemetryMetrics;
import com.phillippitts.slawatch.service.telemetry.BacklogResyncScheduler;
import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import com.phillippitts.slawatch.service.telemetry.breaker.CircuitBreaker;
import com.phillippitts.slawatch.service.telemetry.retry.ExponentialBackoffRetryPolicy;
import com.phillippitts.slawatch.service.telemetry.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the telemetry shipping layer explicitly: one breaker, retry policy and backlog per remote
 * endpoint, owned by the application context and injected into the client.
 */
@Configuration
public class TelemetryConfig {

    private final TelemetryProperties telemetryProperties;
    private final IngestProperties ingestProperties;

    public TelemetryConfig(TelemetryProperties telemetryProperties, IngestProperties ingestProperties) {
        this.telemetryProperties = telemetryProperties;
        this.ingestProperties = ingestProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for the ingestion backend. The read timeout matches the per-attempt remote
     * timeout; the client enforces that bound as well.
     */
    @Bean
    public RestTemplate ingestRestTemplate(RestTemplateBuilder builder) {
        return builder
                .connectTimeout(ingestProperties.getConnectTimeout())
                .readTimeout(telemetryProperties.getRemoteTimeout())
                .build();
    }

    @Bean
    public IngestClient ingestClient(@Qualifier("ingestRestTemplate") RestTemplate restTemplate, Clock clock) {
        return new HttpIngestClient(restTemplate, ingestProperties, clock);
    }

    @Bean
    public CircuitBreaker circuitBreaker(Clock clock, ApplicationEventPublisher publisher) {
        return new CircuitBreaker(telemetryProperties.getBreaker(), clock, publisher);
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return ExponentialBackoffRetryPolicy.from(telemetryProperties.getRetry());
    }

    @Bean
    public LocalStore localStore(Clock clock) {
        TelemetryProperties.Store store = telemetryProperties.getStore();
        RotationPolicy rotation = new RotationPolicy(store.getRotation(), store.getMaxFileSize().toBytes());
        return new JsonLinesLocalStore(Path.of(store.getDirectory()), rotation, store.getRetention(), clock);
    }

    @Bean
    public TelemetryMetrics telemetryMetrics(MeterRegistry registry) {
        return new TelemetryMetrics(registry);
    }

    /**
     * Telemetry client; closed by the context before the executors it depends on, so pending
     * sends are flushed to the backlog while the pools are still running.
     */
    @Bean(destroyMethod = "close")
    public TelemetryClient telemetryClient(IngestClient ingestClient,
                                           CircuitBreaker circuitBreaker,
                                           RetryPolicy retryPolicy,
                                           LocalStore localStore,
                                           @Qualifier("telemetryExecutor") ThreadPoolTaskExecutor telemetryExecutor,
                                           @Qualifier("telemetryScheduler") ThreadPoolTaskScheduler telemetryScheduler,
                                           ApplicationEventPublisher publisher,
                                           TelemetryMetrics telemetryMetrics) {
        return new TelemetryClient(ingestClient, circuitBreaker, retryPolicy, localStore, telemetryProperties,
                telemetryExecutor, telemetryScheduler, publisher, telemetryMetrics);
    }

    @Bean
    public BacklogResyncScheduler backlogResyncScheduler(TelemetryClient telemetryClient,
                                                         LocalStore localStore,
                                                         @Qualifier("telemetryScheduler")
                                                         ThreadPoolTaskScheduler telemetryScheduler) {
        return new BacklogResyncScheduler(telemetryClient, localStore, telemetryScheduler, telemetryProperties);
    }

    @Bean
    public AlertJournal alertJournal() {
        return new AlertJournal();
    }

    @Bean
    public MetricsCollector metricsCollector(TelemetryClient telemetryClient,
                                             SlaProperties slaProperties,
                                             AlertJournal alertJournal,
                                             TelemetryMetrics telemetryMetrics) {
        return new MetricsCollector(telemetryClient, slaProperties, alertJournal, telemetryMetrics);
    }
}
