package com.codurance.resilience.provider;

import java.util.function.Predicate;

/**
 * Failure reported by an AI provider client. Carries the HTTP status when there was a response,
 * or a timeout flag when there was none.
 */
public class ProviderException extends RuntimeException {
    public static final int NO_STATUS = -1;

    /** Classifier used by {@link ProviderPolicies}: timeouts, rate limits and 5xx are transient. */
    public static final Predicate<Throwable> TRANSIENT =
        e -> e instanceof ProviderException && ((ProviderException) e).isTransient();

    private final String provider;
    private final int statusCode;
    private final boolean timeout;

    public ProviderException(String provider, int statusCode, String message) {
        this(provider, statusCode, false, message, null);
    }

    private ProviderException(String provider, int statusCode, boolean timeout, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    public static ProviderException timeout(String provider, Throwable cause) {
        return new ProviderException(provider, NO_STATUS, true, "request timed out", cause);
    }

    public String getProvider() { return provider; }
    public int getStatusCode() { return statusCode; }
    public boolean isTimeout() { return timeout; }

    public boolean isTransient() {
        return timeout || statusCode == 429 || statusCode >= 500;
    }
}
