package com.codurance.resilience.reliability;

/**
 * Base type for failures raised by the resilience layer itself rather than by the wrapped call.
 * API boundaries typically map these to "service temporarily unavailable".
 */
public abstract class ResilienceException extends RuntimeException {

    protected ResilienceException(String message) {
        super(message);
    }

    protected ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
