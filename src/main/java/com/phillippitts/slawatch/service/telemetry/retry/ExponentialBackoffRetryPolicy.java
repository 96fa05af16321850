package com.phillippitts.slawatch.service.telemetry.retry;

import com.phillippitts.slawatch.config.properties.TelemetryProperties;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff: {@code delay = base * 2^(attempt-1)}.
 *
 * <p>With the default base of one second and three retries the schedule is 1s, 2s, 4s across four
 * tries. The next step of the sequence (8s) is not a fourth retry; it seeds the breaker cooldown.
 *
 * <p>Optional jitter spreads each delay uniformly over {@code [delay * (1 - jitter), delay]} so
 * that senders that failed together do not retry together. Jitter never lengthens a delay.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    // 2^20 * base is far beyond any sensible delay; keeps the shift from overflowing
    private static final int MAX_EXPONENT = 20;

    private final Duration baseDelay;
    private final int maxRetries;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(Duration baseDelay, int maxRetries, double jitter) {
        this(baseDelay, maxRetries, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffRetryPolicy(Duration baseDelay, int maxRetries, double jitter, DoubleSupplier random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay must not be negative, got: " + baseDelay);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be >= 0, got: " + maxRetries);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Jitter must be between 0.0 and 1.0, got: " + jitter);
        }
        this.maxRetries = maxRetries;
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static ExponentialBackoffRetryPolicy from(TelemetryProperties.Retry props) {
        return new ExponentialBackoffRetryPolicy(props.getBaseDelay(), props.getMaxRetries(), props.getJitter());
    }

    @Override
    public Duration nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1, got: " + attempt);
        }
        int exponent = Math.min(attempt - 1, MAX_EXPONENT);
        long millis = baseDelay.toMillis() << exponent;
        if (jitter > 0.0) {
            millis -= (long) (millis * jitter * random.getAsDouble());
        }
        return Duration.ofMillis(millis);
    }

    @Override
    public int maxAttempts() {
        return maxRetries;
    }
}
