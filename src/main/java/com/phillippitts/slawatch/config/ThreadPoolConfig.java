package com.phillippitts.slawatch.config;

import com.phillippitts.slawatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by telemetry shipping.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on channel count and backend latency.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool that runs remote delivery attempts.
     *
     * <p>Each attempt runs here so that a hung remote call only occupies a pool thread, never the
     * caller, the breaker lock or the backlog lock. The caller waits on the attempt with its own
     * timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the submitting thread runs the attempt,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request correlation IDs in async logs.
     *
     * @return Configured executor for remote delivery attempts
     */
    @Bean(name = "telemetryExecutor")
    public ThreadPoolTaskExecutor telemetryExecutor() {
        ThreadPoolProperties.TelemetryPoolProperties props = threadPoolProperties.getTelemetry();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the scheduler for retry backoff continuations and periodic backlog resync.
     *
     * <p>Backoff is a scheduled continuation, not a sleeping thread: a send waiting for its next
     * attempt holds no thread and no lock.
     *
     * @return Configured scheduler
     */
    @Bean(name = "telemetryScheduler")
    public ThreadPoolTaskScheduler telemetryScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setTaskDecorator(mdcPropagatingDecorator());
        scheduler.initialize();
        return scheduler;
    }

    private static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
