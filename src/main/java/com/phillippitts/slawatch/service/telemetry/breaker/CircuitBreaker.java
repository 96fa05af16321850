package com.phillippitts.slawatch.service.telemetry.breaker;

import com.phillippitts.slawatch.config.properties.TelemetryProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe circuit breaker guarding the remote ingestion backend.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CLOSED    → OPEN       (failureCount reaches threshold within the failure window)
 * OPEN      → HALF_OPEN  (first allow() after the cooldown; that call is the single trial)
 * HALF_OPEN → CLOSED     (trial succeeds; counters and cooldown reset)
 * HALF_OPEN → OPEN       (trial fails; cooldown grows by the multiplier, capped)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All reads and writes go through one {@link ReentrantLock}. Events are
 * published after the lock is released so listeners may call back into the breaker.
 *
 * <p>One instance exists per remote endpoint; it is created by the application context and
 * injected into the telemetry client.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration baseCooldown;
    private final Duration maxCooldown;
    private final double cooldownMultiplier;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant openedAt;
    private Duration currentCooldown;
    private boolean trialInFlight;

    public CircuitBreaker(TelemetryProperties.Breaker props, Clock clock, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(props, "props");
        this.failureThreshold = props.getFailureThreshold();
        this.failureWindow = props.getFailureWindow();
        this.baseCooldown = props.getCooldown();
        this.maxCooldown = props.getMaxCooldown().compareTo(props.getCooldown()) < 0
                ? props.getCooldown() : props.getMaxCooldown();
        this.cooldownMultiplier = props.getCooldownMultiplier();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.currentCooldown = baseCooldown;
        LOG.info("Circuit breaker initialized (threshold={}, window={}, cooldown={}, maxCooldown={})",
                failureThreshold, failureWindow, baseCooldown, maxCooldown);
    }

    /**
     * Returns whether a request may be sent now.
     *
     * <p>In OPEN before the cooldown has elapsed this returns false with no side effects. The first
     * call after the cooldown moves the breaker to HALF_OPEN and returns true: the caller owns the
     * trial and must report its result. Further calls return false until the trial resolves.
     */
    public boolean allow() {
        CircuitStateChangedEvent transition = null;
        boolean allowed;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> allowed = true;
                case OPEN -> {
                    Instant now = clock.instant();
                    if (now.isBefore(openedAt.plus(currentCooldown))) {
                        allowed = false;
                    } else {
                        transition = transitionTo(CircuitState.HALF_OPEN, now);
                        trialInFlight = true;
                        allowed = true;
                    }
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        allowed = false;
                    } else {
                        trialInFlight = true;
                        allowed = true;
                    }
                }
                default -> throw new IllegalStateException("Unknown state " + state);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
        return allowed;
    }

    /**
     * Records a successful remote call. In CLOSED a single success clears the failure history;
     * in HALF_OPEN it closes the circuit. A late success while OPEN leaves the circuit open until
     * its cooldown elapses and a half-open trial succeeds.
     */
    public void recordSuccess() {
        CircuitStateChangedEvent transition = null;
        lock.lock();
        try {
            failureCount = 0;
            if (state == CircuitState.HALF_OPEN) {
                currentCooldown = baseCooldown;
                openedAt = null;
                trialInFlight = false;
                transition = transitionTo(CircuitState.CLOSED, clock.instant());
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * Records a failed remote call (retriable failure or timeout).
     */
    public void recordFailure() {
        CircuitStateChangedEvent transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (lastFailureAt != null && Duration.between(lastFailureAt, now).compareTo(failureWindow) > 0) {
                failureCount = 0;
            }
            failureCount++;
            lastFailureAt = now;

            switch (state) {
                case CLOSED -> {
                    if (failureCount >= failureThreshold) {
                        openedAt = now;
                        transition = transitionTo(CircuitState.OPEN, now);
                    }
                }
                case HALF_OPEN -> {
                    trialInFlight = false;
                    currentCooldown = nextCooldown();
                    openedAt = now;
                    transition = transitionTo(CircuitState.OPEN, now);
                }
                case OPEN -> {
                    // Late result from a request that started before the circuit opened
                }
                default -> throw new IllegalStateException("Unknown state " + state);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * Releases a half-open trial whose request ended without a verdict on backend health
     * (for example a non-retriable rejection), so another caller may run the trial.
     */
    public void releaseTrial() {
        lock.lock();
        try {
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public BreakerSnapshot snapshot() {
        lock.lock();
        try {
            return new BreakerSnapshot(state, failureCount, lastFailureAt, openedAt, currentCooldown);
        } finally {
            lock.unlock();
        }
    }

    private Duration nextCooldown() {
        long grownMillis = (long) (currentCooldown.toMillis() * cooldownMultiplier);
        Duration grown = Duration.ofMillis(grownMillis);
        return grown.compareTo(maxCooldown) > 0 ? maxCooldown : grown;
    }

    // Caller must hold the lock
    private CircuitStateChangedEvent transitionTo(CircuitState next, Instant at) {
        CircuitState previous = state;
        state = next;
        switch (next) {
            case OPEN -> LOG.warn("Circuit OPEN after {} consecutive failures; blocking remote calls for {}",
                    failureCount, currentCooldown);
            case HALF_OPEN -> LOG.info("Circuit HALF_OPEN; allowing a single trial request");
            case CLOSED -> LOG.info("Circuit CLOSED; remote backend recovered");
            default -> { }
        }
        return new CircuitStateChangedEvent(previous, next, failureCount, at);
    }

    private void publish(CircuitStateChangedEvent event) {
        if (event != null) {
            publisher.publishEvent(event);
        }
    }
}
