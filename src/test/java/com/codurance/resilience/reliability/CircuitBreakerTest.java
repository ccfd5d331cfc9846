package com.codurance.resilience.reliability;

import com.codurance.resilience.metrics.MetricPublisher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class CircuitBreakerTest {
    private final MutableClock clock = new MutableClock();
    private final MetricPublisher metrics = mock(MetricPublisher.class);
    private final CircuitBreaker breaker =
        new CircuitBreaker("cohere_embed", CircuitBreakerConfig.of(3, Duration.ofSeconds(60)), clock, metrics);

    private void openBreaker() {
        for (int i = 0; i < 3; i++)
            breaker.recordFailure();
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());
    }

    @Test
    public void startsClosedWithNoFailures() {
        assertEquals(CircuitBreakerState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.snapshot().getFailureCount());
        assertNull(breaker.snapshot().getLastFailureTime());
        assertTrue(breaker.isAvailable());
    }

    @Test
    public void staysClosedBelowThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertEquals(CircuitBreakerState.CLOSED, breaker.currentState());
        assertEquals(2, breaker.snapshot().getFailureCount());
        assertTrue(breaker.isAvailable());
        verify(metrics, never()).incrementStateChange(eq("cohere_embed"), eq(CircuitBreakerState.CLOSED),
            eq(CircuitBreakerState.OPEN));
    }

    @Test
    public void opensAtThreshold() {
        openBreaker();
        assertFalse(breaker.isAvailable());
        assertNotNull(breaker.snapshot().getLastFailureTime());
        verify(metrics, times(1)).incrementStateChange("cohere_embed", CircuitBreakerState.CLOSED,
            CircuitBreakerState.OPEN);
    }

    @Test
    public void successBetweenFailuresResetsTheCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        assertEquals(0, breaker.snapshot().getFailureCount());
        breaker.recordFailure();
        breaker.recordFailure();
        assertEquals(CircuitBreakerState.CLOSED, breaker.currentState());
    }

    @Test
    public void remainsOpenUntilRecoveryTimeoutHasPassed() {
        openBreaker();
        clock.advance(Duration.ofSeconds(60));
        assertFalse(breaker.isAvailable(), "exactly at the timeout the breaker is still open");
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());

        clock.advance(Duration.ofMillis(1));
        assertTrue(breaker.isAvailable());
        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.currentState());
        verify(metrics).incrementStateChange("cohere_embed", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
        verify(metrics).observeOpenDuration(eq("cohere_embed"), anyDouble());
    }

    @Test
    public void currentStateHasNoSideEffects() {
        openBreaker();
        clock.advance(Duration.ofMinutes(5));
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());
    }

    @Test
    public void failureWhileHalfOpenReopensWithFreshTimestamp() {
        openBreaker();
        Instant openedAt = breaker.snapshot().getLastFailureTime();
        clock.advance(Duration.ofSeconds(61));
        assertTrue(breaker.isAvailable());

        breaker.recordFailure();
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());
        assertTrue(breaker.snapshot().getLastFailureTime().isAfter(openedAt));
        assertFalse(breaker.isAvailable());
        verify(metrics).incrementStateChange("cohere_embed", CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN);
    }

    @Test
    public void successWhileHalfOpenCloses() {
        openBreaker();
        clock.advance(Duration.ofSeconds(61));
        assertTrue(breaker.isAvailable());

        breaker.recordSuccess();
        assertEquals(CircuitBreakerState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.snapshot().getFailureCount());
        assertNull(breaker.snapshot().getLastFailureTime());
        verify(metrics).incrementStateChange("cohere_embed", CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    public void lateFailureWhileOpenExtendsCooldown() {
        openBreaker();
        clock.advance(Duration.ofSeconds(50));
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(20));
        assertFalse(breaker.isAvailable());
        assertEquals(4, breaker.snapshot().getFailureCount());
    }

    @Test
    public void lateSuccessWhileOpenIsIgnored() {
        openBreaker();
        breaker.recordSuccess();
        assertEquals(CircuitBreakerState.OPEN, breaker.currentState());
        assertFalse(breaker.isAvailable());
    }

    @Test
    public void resetForcesClosedFromAnyState() {
        openBreaker();
        breaker.reset();
        assertEquals(CircuitBreakerState.CLOSED, breaker.currentState());
        assertEquals(0, breaker.snapshot().getFailureCount());
        assertTrue(breaker.isAvailable());
        verify(metrics).incrementStateChange("cohere_embed", CircuitBreakerState.OPEN, CircuitBreakerState.CLOSED);

        breaker.reset();
        verify(metrics, times(1)).incrementStateChange("cohere_embed", CircuitBreakerState.OPEN,
            CircuitBreakerState.CLOSED);
    }

    @Test
    public void metricFailuresDoNotEscape() {
        MetricPublisher failing = new MetricPublisher() {
            @Override public void incrementRetry(String operation, int attempt, String circuitBreaker) {}
            @Override public void incrementStateChange(String cb, CircuitBreakerState from, CircuitBreakerState to) {
                throw new IllegalStateException("sink down");
            }
            @Override public void observeOpenDuration(String circuitBreaker, double seconds) {}
        };
        CircuitBreaker cb = new CircuitBreaker("x", CircuitBreakerConfig.of(1, Duration.ofSeconds(1)), clock, failing);
        assertDoesNotThrow(cb::recordFailure);
        assertEquals(CircuitBreakerState.OPEN, cb.currentState());
    }

    @Test
    public void concurrentFailuresAreNeverLost() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("concurrent", CircuitBreakerConfig.of(1_000_000, Duration.ofSeconds(60)),
            clock, metrics);
        int threads = 8;
        int perThread = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futs = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futs.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++)
                    cb.recordFailure();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futs)
            f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(threads * perThread, cb.snapshot().getFailureCount());
    }

    @Test
    public void concurrentTripIsReportedOnce() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("trip", CircuitBreakerConfig.of(5, Duration.ofSeconds(60)), clock, metrics);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futs = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futs.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++)
                    cb.recordFailure();
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futs)
            f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(CircuitBreakerState.OPEN, cb.currentState());
        verify(metrics, times(1)).incrementStateChange("trip", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
    }

    @Test
    public void everyCallerAfterCooldownIsAdmittedAsTrial() throws Exception {
        openBreaker();
        clock.advance(Duration.ofSeconds(61));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futs = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futs.add(pool.submit(() -> {
                start.await();
                return breaker.isAvailable();
            }));
        }
        start.countDown();
        for (Future<Boolean> f : futs)
            assertTrue(f.get(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(CircuitBreakerState.HALF_OPEN, breaker.currentState());
        verify(metrics, times(1)).incrementStateChange("cohere_embed", CircuitBreakerState.OPEN,
            CircuitBreakerState.HALF_OPEN);
    }
}
