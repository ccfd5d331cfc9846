package com.codurance.resilience.reliability;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import com.codurance.resilience.metrics.MetricPublisher;
import com.codurance.resilience.metrics.NoOpMetricPublisher;

/**
 * Owns every {@link CircuitBreaker} of the process, keyed by name.
 *
 * Configuration is write-once per name: the first {@link #getOrCreate} call decides the
 * threshold and timeout, later calls get the existing breaker whatever config they pass.
 * Build one registry at startup and hand it to every executor.
 */
public class CircuitBreakerRegistry {
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final MetricPublisher metricPublisher;

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC(), new NoOpMetricPublisher());
    }

    public CircuitBreakerRegistry(MetricPublisher metricPublisher) {
        this(Clock.systemUTC(), metricPublisher);
    }

    public CircuitBreakerRegistry(Clock clock, MetricPublisher metricPublisher) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricPublisher = Objects.requireNonNull(metricPublisher, "metricPublisher");
    }

    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        return breakers.computeIfAbsent(name, n -> new CircuitBreaker(n, config, clock, metricPublisher));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(breakers.keySet());
    }

    /** Administrative recovery: forces every known breaker back to CLOSED. */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
