package com.phillippitts.slawatch.config;

import com.phillippitts.slawatch.service.telemetry.TelemetryClient;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes telemetry delivery pool and backlog gauges via Micrometer.
 *
 * <ul>
 *   <li>slawatch.telemetry.pool.active - attempts currently executing</li>
 *   <li>slawatch.telemetry.pool.queued - attempts waiting for a thread</li>
 *   <li>slawatch.telemetry.pool.size - current number of threads</li>
 *   <li>slawatch.telemetry.backlog.size - events awaiting resync</li>
 * </ul>
 *
 * <p>Additionally logs a shipping summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider;
    private final ObjectProvider<TelemetryClient> telemetryClientProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("telemetryExecutor") ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider,
            ObjectProvider<TelemetryClient> telemetryClientProvider) {
        this.telemetryExecutorProvider = telemetryExecutorProvider;
        this.telemetryClientProvider = telemetryClientProvider;
    }

    @Bean
    public MeterBinder telemetryPoolMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = telemetryExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("slawatch.telemetry.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the telemetry pool")
                    .register(registry);

            Gauge.builder("slawatch.telemetry.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Remote delivery attempts currently executing")
                    .register(registry);

            Gauge.builder("slawatch.telemetry.pool.queued", executor, e -> e.getQueue().size())
                    .description("Remote delivery attempts waiting for a thread")
                    .register(registry);

            Gauge.builder("slawatch.telemetry.backlog.size", telemetryClientProvider,
                            p -> p.getObject().backlogSize())
                    .description("Telemetry events awaiting resync")
                    .register(registry);

            LOG.info("Telemetry metrics registered: slawatch.telemetry.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logShippingHealth() {
        ThreadPoolExecutor executor = telemetryExecutorProvider.getObject().getThreadPoolExecutor();
        TelemetryClient client = telemetryClientProvider.getObject();

        LOG.info("Telemetry health: circuit={}, backlog={}, pool={}/{}, active={}, queued={}",
                client.breakerSnapshot().state(),
                client.backlogSize(),
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size());
    }
}
