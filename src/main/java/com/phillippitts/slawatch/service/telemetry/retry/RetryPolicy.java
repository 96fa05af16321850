package com.phillippitts.slawatch.service.telemetry.retry;

import java.time.Duration;

/**
 * Decides how long a send waits between remote attempts and how many retries it gets.
 *
 * <p>Implementations must be thread-safe; one policy is shared by all senders.
 */
public interface RetryPolicy {

    /**
     * Delay to wait after the given failed attempt before the next one.
     *
     * @param attempt 1-based number of the attempt that just failed
     * @return delay before the next attempt (never negative)
     * @throws IllegalArgumentException if attempt is less than 1
     */
    Duration nextDelay(int attempt);

    /**
     * Retries allowed after the initial attempt. A send makes at most {@code maxAttempts() + 1} tries.
     */
    int maxAttempts();
}
