package com.phillippitts.slawatch.config.properties;

import com.phillippitts.slawatch.service.backlog.RotationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for telemetry shipping: remote timeout, circuit breaker, retry
 * backoff, backlog storage and resync scheduling.
 *
 * <p>Every value can be overridden under {@code slawatch.telemetry.*}.
 */
@ConfigurationProperties(prefix = "slawatch.telemetry")
@Validated
public class TelemetryProperties {

    /** Upper bound for a single remote delivery attempt. */
    @NotNull
    private Duration remoteTimeout = Duration.ofSeconds(5);

    /** Fixed delay between periodic backlog resync cycles. */
    @NotNull
    private Duration resyncInterval = Duration.ofSeconds(45);

    /** Maximum records delivered in one resync cycle. */
    @Positive(message = "Resync batch limit must be positive")
    private int resyncBatchLimit = 500;

    /** How long shutdown waits for in-flight attempts before flushing the rest to the backlog. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(10);

    @Valid
    private Breaker breaker = new Breaker();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Store store = new Store();

    public Duration getRemoteTimeout() {
        return remoteTimeout;
    }

    public void setRemoteTimeout(Duration remoteTimeout) {
        this.remoteTimeout = remoteTimeout;
    }

    public Duration getResyncInterval() {
        return resyncInterval;
    }

    public void setResyncInterval(Duration resyncInterval) {
        this.resyncInterval = resyncInterval;
    }

    public int getResyncBatchLimit() {
        return resyncBatchLimit;
    }

    public void setResyncBatchLimit(int resyncBatchLimit) {
        this.resyncBatchLimit = resyncBatchLimit;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    /**
     * Circuit breaker thresholds.
     */
    public static class Breaker {

        /** Consecutive failures (within the window) that open the circuit. */
        @Positive(message = "Failure threshold must be positive")
        private int failureThreshold = 3;

        /** Failures older than this no longer count toward the threshold. */
        @NotNull
        private Duration failureWindow = Duration.ofSeconds(60);

        /** Initial open period; matches the fourth step (8s) of the retry schedule. */
        @NotNull
        private Duration cooldown = Duration.ofSeconds(8);

        /** Cap for the cooldown after repeated failed half-open trials. */
        @NotNull
        private Duration maxCooldown = Duration.ofSeconds(30);

        /** Growth factor applied to the cooldown when a half-open trial fails. */
        @DecimalMin("1.0")
        private double cooldownMultiplier = 2.0;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getFailureWindow() {
            return failureWindow;
        }

        public void setFailureWindow(Duration failureWindow) {
            this.failureWindow = failureWindow;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public Duration getMaxCooldown() {
            return maxCooldown;
        }

        public void setMaxCooldown(Duration maxCooldown) {
            this.maxCooldown = maxCooldown;
        }

        public double getCooldownMultiplier() {
            return cooldownMultiplier;
        }

        public void setCooldownMultiplier(double cooldownMultiplier) {
            this.cooldownMultiplier = cooldownMultiplier;
        }
    }

    /**
     * Exponential backoff between attempts of a single send.
     */
    public static class Retry {

        /** Delay before the first retry; doubles on every further retry. */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        /** Retries after the initial attempt (3 retries = 4 tries, delays 1s/2s/4s). */
        @Min(value = 0, message = "Max retries must be >= 0")
        private int maxRetries = 3;

        /** Random jitter as a fraction of each delay (0 disables jitter). */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.0;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Local backlog storage.
     */
    public static class Store {

        @NotBlank
        private String directory = "telemetry-backlog";

        @NotNull
        private RotationPolicy.Mode rotation = RotationPolicy.Mode.DAILY_OR_SIZE;

        @NotNull
        private DataSize maxFileSize = DataSize.ofMegabytes(10);

        /** Fully synced segments older than this are deleted. */
        @NotNull
        private Duration retention = Duration.ofDays(7);

        /** Write attempts for an event before it is dropped from the in-memory buffer. */
        @Positive(message = "Max write attempts must be positive")
        private int maxWriteAttempts = 3;

        /** Events held in memory while the backlog is not writable. */
        @Positive(message = "Memory buffer capacity must be positive")
        private int memoryBufferCapacity = 1000;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public RotationPolicy.Mode getRotation() {
            return rotation;
        }

        public void setRotation(RotationPolicy.Mode rotation) {
            this.rotation = rotation;
        }

        public DataSize getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(DataSize maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getMaxWriteAttempts() {
            return maxWriteAttempts;
        }

        public void setMaxWriteAttempts(int maxWriteAttempts) {
            this.maxWriteAttempts = maxWriteAttempts;
        }

        public int getMemoryBufferCapacity() {
            return memoryBufferCapacity;
        }

        public void setMemoryBufferCapacity(int memoryBufferCapacity) {
            this.memoryBufferCapacity = memoryBufferCapacity;
        }
    }
}
