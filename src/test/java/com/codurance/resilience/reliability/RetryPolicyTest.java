package com.codurance.resilience.reliability;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    @Test
    public void retriesEveryExceptionByDefault() {
        RetryPolicy policy = RetryPolicy.builder().build();
        assertTrue(policy.isRetryable(new IllegalStateException()));
        assertTrue(policy.isRetryable(new IOException()));
        assertFalse(policy.isRetryable(new AssertionError()));
        assertFalse(policy.isRetryable(null));
        assertTrue(policy.getCircuitBreakerName().isEmpty());
    }

    @Test
    public void typeListIncludesSubclasses() {
        RetryPolicy policy = RetryPolicy.builder().retryOn(IOException.class).build();
        assertTrue(policy.isRetryable(new java.net.SocketTimeoutException()));
        assertFalse(policy.isRetryable(new IllegalArgumentException()));
    }

    @Test
    public void predicateAndTypesCombine() {
        RetryPolicy policy = RetryPolicy.builder()
            .retryOn(TimeoutException.class)
            .retryIf(e -> e.getMessage() != null && e.getMessage().contains("503"))
            .build();
        assertTrue(policy.isRetryable(new TimeoutException()));
        assertTrue(policy.isRetryable(new RuntimeException("status 503")));
        assertFalse(policy.isRetryable(new RuntimeException("status 400")));
    }

    @Test
    public void carriesBreakerBinding() {
        CircuitBreakerConfig config = CircuitBreakerConfig.of(7, Duration.ofSeconds(15));
        RetryPolicy policy = RetryPolicy.builder().circuitBreaker("cohere_embed", config).build();
        assertEquals("cohere_embed", policy.getCircuitBreakerName().orElseThrow());
        assertSame(config, policy.getCircuitBreakerConfig());
    }

    @Test
    public void breakerConfigRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerConfig.of(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerConfig.of(1, Duration.ZERO));
        assertThrows(NullPointerException.class, () -> CircuitBreakerConfig.of(1, null));
    }
}
