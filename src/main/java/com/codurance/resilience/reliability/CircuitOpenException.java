package com.codurance.resilience.reliability;

import java.time.Duration;

/**
 * The breaker rejected the call before the operation was invoked.
 */
public class CircuitOpenException extends ResilienceException {
    private final String circuitBreakerName;
    private final Duration recoveryTimeout;

    public CircuitOpenException(String circuitBreakerName, Duration recoveryTimeout) {
        super("Circuit breaker '" + circuitBreakerName + "' is open. Service may be experiencing issues. "
            + "Retry after " + recoveryTimeout.toSeconds() + " seconds.");
        this.circuitBreakerName = circuitBreakerName;
        this.recoveryTimeout = recoveryTimeout;
    }

    public String getCircuitBreakerName() { return circuitBreakerName; }
    public Duration getRecoveryTimeout() { return recoveryTimeout; }
}
