package com.codurance.resilience.reliability;

/**
 * Every allowed attempt failed with a retryable error. The cause is the last of those errors.
 */
public class AttemptsExhaustedException extends ResilienceException {
    private final String operation;
    private final int attempts;

    public AttemptsExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempts: " + lastError, lastError);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() { return operation; }
    public int getAttempts() { return attempts; }
}
