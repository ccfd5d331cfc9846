package com.codurance.resilience.reliability;

import java.time.Duration;

/**
 * What happened on one call inside a single retry run. Never stored; handed to listeners and logs.
 */
public final class RetryAttempt {

    public enum Outcome {
        SUCCESS,
        RETRYABLE_ERROR,
        FATAL_ERROR
    }

    private final int attemptNumber;
    private final Outcome outcome;
    private final Duration waitBeforeNext;
    private final Throwable error;

    public RetryAttempt(int attemptNumber, Outcome outcome, Duration waitBeforeNext, Throwable error) {
        this.attemptNumber = attemptNumber;
        this.outcome = outcome;
        this.waitBeforeNext = waitBeforeNext;
        this.error = error;
    }

    public int getAttemptNumber() { return attemptNumber; }
    public Outcome getOutcome() { return outcome; }

    /** Null when no further call follows this one. */
    public Duration getWaitBeforeNext() { return waitBeforeNext; }

    public Throwable getError() { return error; }

    @Override
    public String toString() {
        return "RetryAttempt{attemptNumber=" + attemptNumber
            + ", outcome=" + outcome
            + ", waitBeforeNext=" + waitBeforeNext
            + (error == null ? "" : ", error=" + error)
            + '}';
    }
}
