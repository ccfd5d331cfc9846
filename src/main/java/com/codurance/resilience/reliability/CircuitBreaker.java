package com.codurance.resilience.reliability;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.resilience.metrics.MetricPublisher;
import com.codurance.resilience.metrics.NoOpMetricPublisher;

/**
 * Named circuit breaker guarding one class of downstream call.
 *
 * <pre>
 *   CLOSED --(failureCount >= threshold)--> OPEN
 *   OPEN --(checked after recoveryTimeout)--> HALF_OPEN
 *   HALF_OPEN --(success)--> CLOSED
 *   HALF_OPEN --(failure)--> OPEN
 * </pre>
 *
 * The OPEN to HALF_OPEN move happens lazily inside {@link #isAvailable()}; there is no timer.
 * Every caller that checks the breaker after the cooldown sees HALF_OPEN and is let through,
 * so several trial calls may run at once. Trial admission is not limited to a single caller.
 *
 * All state lives in one immutable {@link Snapshot} swapped by compare-and-set. Each transition
 * is won by exactly one thread, which reports it to the {@link MetricPublisher}.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final MetricPublisher metricPublisher;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.INITIAL);

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), new NoOpMetricPublisher());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, MetricPublisher metricPublisher) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        this.failureThreshold = config.getFailureThreshold();
        this.recoveryTimeout = config.getRecoveryTimeout();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricPublisher = Objects.requireNonNull(metricPublisher, "metricPublisher");
    }

    public String getName() { return name; }
    public int getFailureThreshold() { return failureThreshold; }
    public Duration getRecoveryTimeout() { return recoveryTimeout; }

    /**
     * Returns false only while the breaker is effectively OPEN. When the recovery timeout has
     * elapsed since the last failure, moves the breaker to HALF_OPEN and returns true.
     */
    public boolean isAvailable() {
        while (true) {
            Snapshot current = snapshot.get();
            if (current.state != CircuitBreakerState.OPEN)
                return true;

            Instant now = clock.instant();
            if (Duration.between(current.lastFailureTime, now).compareTo(recoveryTimeout) <= 0)
                return false;

            Snapshot next = new Snapshot(CircuitBreakerState.HALF_OPEN, current.failureCount,
                current.lastFailureTime, null);
            if (snapshot.compareAndSet(current, next)) {
                logger.info("circuit_breaker_half_open name={} failure_count={}", name, current.failureCount);
                transitioned(current, next, now);
                return true;
            }
        }
    }

    public void recordSuccess() {
        while (true) {
            Snapshot current = snapshot.get();
            Snapshot next;
            switch (current.state) {
                case HALF_OPEN:
                    next = Snapshot.INITIAL;
                    break;
                case CLOSED:
                    if (current.failureCount == 0)
                        return;
                    next = new Snapshot(CircuitBreakerState.CLOSED, 0, current.lastFailureTime, null);
                    break;
                default:
                    // a late success from a call admitted before the breaker opened
                    return;
            }
            if (!snapshot.compareAndSet(current, next))
                continue;

            if (current.state == CircuitBreakerState.HALF_OPEN) {
                logger.info("circuit_breaker_closed name={}", name);
                transitioned(current, next, clock.instant());
            } else {
                logger.debug("circuit_breaker_success name={} previous_failure_count={}", name, current.failureCount);
            }
            return;
        }
    }

    public void recordFailure() {
        while (true) {
            Snapshot current = snapshot.get();
            Instant now = clock.instant();
            int count = current.failureCount + 1;
            Snapshot next;
            switch (current.state) {
                case HALF_OPEN:
                    next = new Snapshot(CircuitBreakerState.OPEN, count, now, now);
                    break;
                case CLOSED:
                    next = count >= failureThreshold
                        ? new Snapshot(CircuitBreakerState.OPEN, count, now, now)
                        : new Snapshot(CircuitBreakerState.CLOSED, count, now, null);
                    break;
                default:
                    // already open: extend the cooldown
                    next = new Snapshot(CircuitBreakerState.OPEN, count, now, current.openedAt);
                    break;
            }
            if (!snapshot.compareAndSet(current, next))
                continue;

            if (current.state == CircuitBreakerState.HALF_OPEN) {
                logger.warn("circuit_breaker_reopened name={} failure_count={}", name, count);
                transitioned(current, next, now);
            } else if (current.state == CircuitBreakerState.CLOSED && next.state == CircuitBreakerState.OPEN) {
                logger.error("circuit_breaker_opened name={} failure_count={} failure_threshold={}",
                    name, count, failureThreshold);
                transitioned(current, next, now);
            }
            return;
        }
    }

    /** Forces the breaker back to CLOSED regardless of its current state. */
    public void reset() {
        Snapshot previous = snapshot.getAndSet(Snapshot.INITIAL);
        logger.info("circuit_breaker_reset name={} previous_state={}", name, previous.state.label());
        if (previous.state != CircuitBreakerState.CLOSED)
            transitioned(previous, Snapshot.INITIAL, clock.instant());
    }

    public CircuitBreakerState currentState() {
        return snapshot.get().state;
    }

    public Snapshot snapshot() {
        return snapshot.get();
    }

    private void transitioned(Snapshot from, Snapshot to, Instant now) {
        try {
            metricPublisher.incrementStateChange(name, from.state, to.state);
            if (from.state == CircuitBreakerState.OPEN && from.openedAt != null) {
                double seconds = Duration.between(from.openedAt, now).toNanos() / 1_000_000_000.0;
                metricPublisher.observeOpenDuration(name, seconds);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to publish state change for circuit breaker {}", name, e);
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker{name=" + name + ", " + snapshot.get() + '}';
    }

    /**
     * Point-in-time view of a breaker. {@code lastFailureTime} is never null while OPEN.
     */
    public static final class Snapshot {
        static final Snapshot INITIAL = new Snapshot(CircuitBreakerState.CLOSED, 0, null, null);

        private final CircuitBreakerState state;
        private final int failureCount;
        private final Instant lastFailureTime;
        private final Instant openedAt;

        private Snapshot(CircuitBreakerState state, int failureCount, Instant lastFailureTime, Instant openedAt) {
            this.state = state;
            this.failureCount = failureCount;
            this.lastFailureTime = lastFailureTime;
            this.openedAt = openedAt;
        }

        public CircuitBreakerState getState() { return state; }
        public int getFailureCount() { return failureCount; }
        public Instant getLastFailureTime() { return lastFailureTime; }

        @Override
        public String toString() {
            return "state=" + state + ", failureCount=" + failureCount + ", lastFailureTime=" + lastFailureTime;
        }
    }
}
