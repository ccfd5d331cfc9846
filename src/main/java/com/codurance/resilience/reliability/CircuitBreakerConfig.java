package com.codurance.resilience.reliability;

import java.time.Duration;
import java.util.Objects;

public final class CircuitBreakerConfig {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    private final int failureThreshold;
    private final Duration recoveryTimeout;

    private CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout) {
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
        if (failureThreshold <= 0)
            throw new IllegalArgumentException("failureThreshold must be > 0, was " + failureThreshold);
        if (recoveryTimeout.isZero() || recoveryTimeout.isNegative())
            throw new IllegalArgumentException("recoveryTimeout must be > 0, was " + recoveryTimeout);
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
    }

    public static CircuitBreakerConfig of(int failureThreshold, Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout);
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT);
    }

    public int getFailureThreshold() { return failureThreshold; }
    public Duration getRecoveryTimeout() { return recoveryTimeout; }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{failureThreshold=" + failureThreshold
            + ", recoveryTimeout=" + recoveryTimeout + '}';
    }
}
