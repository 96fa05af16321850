package com.phillippitts.slawatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the telemetry executor (remote delivery attempts) and the
 * telemetry scheduler (retry backoff continuations and periodic resync).
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private TelemetryPoolProperties telemetry = new TelemetryPoolProperties();
    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();

    public TelemetryPoolProperties getTelemetry() {
        return telemetry;
    }

    public void setTelemetry(TelemetryPoolProperties telemetry) {
        this.telemetry = telemetry;
    }

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Telemetry delivery pool configuration.
     */
    public static class TelemetryPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "telemetry-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Scheduler pool configuration.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "telemetry-sched-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
