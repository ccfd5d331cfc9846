package com.codurance.resilience.provider;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import com.codurance.resilience.reliability.BackoffPolicy;
import com.codurance.resilience.reliability.CircuitBreakerConfig;
import com.codurance.resilience.reliability.RetryPolicy;

/**
 * Retry presets per provider call type. Embedding and chat get separate breakers so an outage
 * of one endpoint does not block the other.
 */
public final class ProviderPolicies {
    public static final String EMBEDDING_BREAKER = "cohere_embed";
    public static final String CHAT_BREAKER = "cohere_chat";

    private static final CircuitBreakerConfig BREAKER_CONFIG = CircuitBreakerConfig.of(5, Duration.ofSeconds(60));

    private ProviderPolicies() {
    }

    public static RetryPolicy embedding() {
        return RetryPolicy.builder()
            .backoff(BackoffPolicy.builder()
                .maxRetries(3)
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(32))
                .exponentialBase(2)
                .jitterFactor(0.1)
                .build())
            .retryOn(TimeoutException.class, IOException.class)
            .retryIf(ProviderException.TRANSIENT)
            .circuitBreaker(EMBEDDING_BREAKER, BREAKER_CONFIG)
            .build();
    }

    public static RetryPolicy chat() {
        return RetryPolicy.builder()
            .backoff(BackoffPolicy.builder()
                .maxRetries(2)
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(16))
                .exponentialBase(2)
                .jitterFactor(0.1)
                .build())
            .retryOn(TimeoutException.class, IOException.class)
            .retryIf(ProviderException.TRANSIENT)
            .circuitBreaker(CHAT_BREAKER, BREAKER_CONFIG)
            .build();
    }
}
