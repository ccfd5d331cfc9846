package com.codurance.resilience.reliability;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable backoff configuration: how many retries and how long to wait between them.
 */
public final class BackoffPolicy {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final int DEFAULT_EXPONENTIAL_BASE = 2;
    public static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int exponentialBase;
    private final double jitterFactor;

    private BackoffPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelay = Objects.requireNonNull(builder.baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay");
        this.exponentialBase = builder.exponentialBase;
        this.jitterFactor = builder.jitterFactor;

        if (maxRetries < 0)
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        if (baseDelay.isZero() || baseDelay.isNegative())
            throw new IllegalArgumentException("baseDelay must be > 0, was " + baseDelay);
        if (maxDelay.compareTo(baseDelay) < 0)
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, was " + maxDelay);
        if (exponentialBase < 1)
            throw new IllegalArgumentException("exponentialBase must be >= 1, was " + exponentialBase);
        if (!(jitterFactor >= 0.0 && jitterFactor <= 1.0))
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], was " + jitterFactor);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackoffPolicy defaults() {
        return builder().build();
    }

    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public int getExponentialBase() { return exponentialBase; }
    public double getJitterFactor() { return jitterFactor; }

    /** Total number of calls allowed: the initial one plus every retry. */
    public int getMaxAttempts() { return maxRetries + 1; }

    @Override
    public String toString() {
        return "BackoffPolicy{maxRetries=" + maxRetries
            + ", baseDelay=" + baseDelay
            + ", maxDelay=" + maxDelay
            + ", exponentialBase=" + exponentialBase
            + ", jitterFactor=" + jitterFactor + '}';
    }

    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private int exponentialBase = DEFAULT_EXPONENTIAL_BASE;
        private double jitterFactor = DEFAULT_JITTER_FACTOR;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder exponentialBase(int exponentialBase) {
            this.exponentialBase = exponentialBase;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(this);
        }
    }
}
