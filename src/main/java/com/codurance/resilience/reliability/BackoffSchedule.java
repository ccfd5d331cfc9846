package com.codurance.resilience.reliability;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter.
 *
 * delay(n) = min(baseDelay * exponentialBase^(n-1), maxDelay) + uniform[0, jitterFactor * capped]
 *
 * Attempt 1 is the wait before the second call; nothing is computed before the first call.
 */
public final class BackoffSchedule {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final Duration LONGEST = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private BackoffSchedule() {
    }

    public static Duration delay(int attemptNumber, BackoffPolicy policy) {
        double capped = cappedSeconds(attemptNumber, policy);
        double jitterBound = policy.getJitterFactor() * capped;
        if (jitterBound <= 0)
            return cappedDelay(attemptNumber, policy);
        double jitter = ThreadLocalRandom.current().nextDouble(0.0, jitterBound);
        return toDuration(capped + jitter);
    }

    /** The deterministic, pre-jitter component of {@link #delay}. */
    public static Duration cappedDelay(int attemptNumber, BackoffPolicy policy) {
        double capped = cappedSeconds(attemptNumber, policy);
        if (capped >= seconds(policy.getMaxDelay()))
            return policy.getMaxDelay();
        return toDuration(capped);
    }

    // seconds as a double: Duration.toNanos() overflows past ~292 years
    private static double cappedSeconds(int attemptNumber, BackoffPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (attemptNumber < 1)
            throw new IllegalArgumentException("attemptNumber must be >= 1, was " + attemptNumber);

        double base = seconds(policy.getBaseDelay());
        double max = seconds(policy.getMaxDelay());
        // pow may overflow to infinity for large attempts; min() saturates it at max
        double exp = base * Math.pow(policy.getExponentialBase(), attemptNumber - 1);
        return Math.min(exp, max);
    }

    private static double seconds(Duration d) {
        return d.getSeconds() + d.getNano() / NANOS_PER_SECOND;
    }

    private static Duration toDuration(double seconds) {
        double whole = Math.floor(seconds);
        if (whole >= Long.MAX_VALUE)
            return LONGEST;
        long nanos = Math.max(0L, Math.round((seconds - whole) * NANOS_PER_SECOND));
        return Duration.ofSeconds((long) whole, nanos);
    }
}
