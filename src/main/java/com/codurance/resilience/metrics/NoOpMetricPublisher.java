package com.codurance.resilience.metrics;

import com.codurance.resilience.reliability.CircuitBreakerState;

/**
 * Default publisher so the executor and breakers run without any metrics backend.
 */
public class NoOpMetricPublisher implements MetricPublisher {
    @Override public void incrementRetry(String operation, int attempt, String circuitBreaker) {}
    @Override public void incrementStateChange(String circuitBreaker, CircuitBreakerState from, CircuitBreakerState to) {}
    @Override public void observeOpenDuration(String circuitBreaker, double seconds) {}
}
