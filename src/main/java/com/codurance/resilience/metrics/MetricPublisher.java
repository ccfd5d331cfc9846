package com.codurance.resilience.metrics;

import com.codurance.resilience.reliability.CircuitBreakerState;

/**
 * Metrics sink for retries and breaker transitions. Calls are fire-and-forget:
 * implementations must not throw back into the caller.
 */
public interface MetricPublisher {

  /** Label used for the breaker of a call that runs without one. */
  String NO_CIRCUIT_BREAKER = "none";

  void incrementRetry(String operation, int attempt, String circuitBreaker);

  void incrementStateChange(String circuitBreaker, CircuitBreakerState from, CircuitBreakerState to);

  void observeOpenDuration(String circuitBreaker, double seconds);

  default void flush() {}
}
