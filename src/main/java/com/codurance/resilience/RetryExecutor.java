package com.codurance.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.resilience.metrics.MetricPublisher;
import com.codurance.resilience.metrics.NoOpMetricPublisher;
import com.codurance.resilience.reliability.AttemptsExhaustedException;
import com.codurance.resilience.reliability.BackoffSchedule;
import com.codurance.resilience.reliability.CircuitBreaker;
import com.codurance.resilience.reliability.CircuitBreakerRegistry;
import com.codurance.resilience.reliability.CircuitOpenException;
import com.codurance.resilience.reliability.RetryAttempt;
import com.codurance.resilience.reliability.RetryPolicy;

/**
 * Runs an asynchronous operation under a {@link RetryPolicy}: circuit breaker check, then up to
 * {@code maxRetries + 1} calls with exponential backoff between retryable failures.
 *
 * Terminal outcomes, all delivered through the returned future:
 * - the operation's value on success;
 * - {@link CircuitOpenException} when the breaker rejects the call (the operation is never invoked);
 * - the original error when it is not retryable;
 * - {@link AttemptsExhaustedException} wrapping the last error when every attempt failed.
 *
 * The breaker hears about a run once, on its final outcome. Intermediate retryable failures are
 * not recorded, so one failing run adds one to the breaker's failure count.
 *
 * Backoff waits are scheduled tasks; no thread sleeps between attempts. Retries run on the
 * scheduler's threads, so the supplier should start its work and return without blocking.
 * No overall deadline is applied: wrap the returned future (e.g. {@code orTimeout}) if one is needed.
 */
public class RetryExecutor implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);
  public static final String DEFAULT_OPERATION_NAME = "operation";
  private static final Duration LONGEST_SCHEDULABLE = Duration.ofNanos(Long.MAX_VALUE);

  private final CircuitBreakerRegistry registry;
  private final MetricPublisher metricPublisher;
  private final AttemptListener attemptListener;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;

  private RetryExecutor(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.metricPublisher = builder.metricPublisher == null ? new NoOpMetricPublisher() : builder.metricPublisher;
    this.attemptListener = builder.attemptListener == null ? AttemptListener.NONE : builder.attemptListener;

    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      AtomicInteger threadIndex = new AtomicInteger();
      this.scheduler = Executors.newScheduledThreadPool(Math.max(1, builder.schedulerThreads), r -> {
        Thread t = new Thread(r, "retry-backoff-" + threadIndex.incrementAndGet());
        t.setDaemon(true);
        return t;
      });
      this.ownsScheduler = true;
    }
  }

  public static Builder newBuilder(CircuitBreakerRegistry registry) {
    return new Builder(registry);
  }

  public CircuitBreakerRegistry getRegistry() {
    return registry;
  }

  /**
   * Same as {@link #run(String, Supplier, RetryPolicy)}, naming the operation after the policy's
   * circuit breaker.
   */
  public <T> CompletableFuture<T> run(Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy) {
    return run(policy.getCircuitBreakerName().orElse(DEFAULT_OPERATION_NAME), operation, policy);
  }

  public <T> CompletableFuture<T> run(String operationName, Supplier<? extends CompletionStage<T>> operation,
      RetryPolicy policy) {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");

    CircuitBreaker breaker = policy.getCircuitBreakerName()
        .map(name -> registry.getOrCreate(name, policy.getCircuitBreakerConfig()))
        .orElse(null);

    if (breaker != null && !breaker.isAvailable()) {
      logger.error("circuit_breaker_open operation={} circuit_breaker={} state={}",
          operationName, breaker.getName(), breaker.currentState().label());
      return CompletableFuture.failedFuture(new CircuitOpenException(breaker.getName(), breaker.getRecoveryTimeout()));
    }

    Run<T> run = new Run<>(operationName, operation, policy, breaker);
    run.attempt(1);
    return run.result;
  }

  @Override
  public void close() throws InterruptedException {
    if (!ownsScheduler)
      return;
    scheduler.shutdown();
    scheduler.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static long saturatedNanos(Duration wait) {
    return wait.compareTo(LONGEST_SCHEDULABLE) >= 0 ? Long.MAX_VALUE : wait.toNanos();
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** State of one {@code run()} call. */
  private final class Run<T> {
    private final String operationName;
    private final Supplier<? extends CompletionStage<T>> operation;
    private final RetryPolicy policy;
    private final CircuitBreaker breaker;
    private final String breakerLabel;
    private final int maxAttempts;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    Run(String operationName, Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy,
        CircuitBreaker breaker) {
      this.operationName = operationName;
      this.operation = operation;
      this.policy = policy;
      this.breaker = breaker;
      this.breakerLabel = breaker == null ? MetricPublisher.NO_CIRCUIT_BREAKER : breaker.getName();
      this.maxAttempts = policy.getBackoff().getMaxAttempts();
    }

    void attempt(int attemptNumber) {
      // the caller cancelled the returned future
      if (result.isDone())
        return;

      CompletionStage<T> stage;
      try {
        stage = Objects.requireNonNull(operation.get(), "operation returned a null stage");
      } catch (Throwable t) {
        complete(attemptNumber, null, t);
        return;
      }
      stage.whenComplete((value, error) -> complete(attemptNumber, value, error == null ? null : unwrap(error)));
    }

    /**
     * Handles the outcome of one call. Anything thrown while handling it (classifier, backoff,
     * breaker) fails the run, since the stage that would otherwise capture it is never read.
     */
    private void complete(int attemptNumber, T value, Throwable error) {
      try {
        if (error == null)
          onSuccess(attemptNumber, value);
        else
          onFailure(attemptNumber, error);
      } catch (Throwable t) {
        if (error != null && error != t)
          t.addSuppressed(error);
        logger.error("retry_loop_failed operation={} circuit_breaker={} attempt={} error_type={} error={}",
            operationName, breakerLabel, attemptNumber, t.getClass().getSimpleName(), t.getMessage(), t);
        result.completeExceptionally(t);
      }
    }

    private void onSuccess(int attemptNumber, T value) {
      // cancelled while this call was in flight
      if (result.isDone())
        return;
      if (breaker != null)
        breaker.recordSuccess();
      report(new RetryAttempt(attemptNumber, RetryAttempt.Outcome.SUCCESS, null, null));
      result.complete(value);
    }

    private void onFailure(int attemptNumber, Throwable error) {
      if (result.isDone())
        return;

      if (!policy.isRetryable(error)) {
        if (breaker != null)
          breaker.recordFailure();
        logger.error("operation_failed operation={} circuit_breaker={} attempt={} error_type={} error={}",
            operationName, breakerLabel, attemptNumber, error.getClass().getSimpleName(), error.getMessage(), error);
        report(new RetryAttempt(attemptNumber, RetryAttempt.Outcome.FATAL_ERROR, null, error));
        result.completeExceptionally(error);
        return;
      }

      if (attemptNumber >= maxAttempts) {
        if (breaker != null)
          breaker.recordFailure();
        logger.error("retry_exhausted operation={} max_retries={} circuit_breaker={} error={}",
            operationName, maxAttempts - 1, breakerLabel, error.getMessage(), error);
        report(new RetryAttempt(attemptNumber, RetryAttempt.Outcome.RETRYABLE_ERROR, null, error));
        result.completeExceptionally(new AttemptsExhaustedException(operationName, attemptNumber, error));
        return;
      }

      Duration wait = BackoffSchedule.delay(attemptNumber, policy.getBackoff());
      long waitNanos = saturatedNanos(wait);
      try {
        metricPublisher.incrementRetry(operationName, attemptNumber, breakerLabel);
      } catch (RuntimeException e) {
        logger.warn("Failed to publish retry metric for {}", operationName, e);
      }
      logger.warn("retry_attempt operation={} attempt={} max_retries={} circuit_breaker={} wait_ms={} error={}",
          operationName, attemptNumber, maxAttempts - 1, breakerLabel, TimeUnit.NANOSECONDS.toMillis(waitNanos),
          error.getMessage());
      report(new RetryAttempt(attemptNumber, RetryAttempt.Outcome.RETRYABLE_ERROR, wait, error));

      try {
        scheduler.schedule(() -> {
          try {
            attempt(attemptNumber + 1);
          } catch (Throwable t) {
            result.completeExceptionally(t);
          }
        }, waitNanos, TimeUnit.NANOSECONDS);
      } catch (RejectedExecutionException e) {
        e.addSuppressed(error);
        result.completeExceptionally(e);
      }
    }

    private void report(RetryAttempt attempt) {
      try {
        attemptListener.onAttempt(operationName, attempt);
      } catch (RuntimeException e) {
        logger.warn("Attempt listener failed for {}", operationName, e);
      }
    }
  }

  public static class Builder {
    private final CircuitBreakerRegistry registry;
    private MetricPublisher metricPublisher = null;
    private AttemptListener attemptListener = null;
    private ScheduledExecutorService scheduler = null;
    private int schedulerThreads = 2;

    public Builder(CircuitBreakerRegistry registry) {
      this.registry = registry;
    }

    public Builder metricPublisher(MetricPublisher mp) {
      this.metricPublisher = mp;
      return this;
    }

    public Builder attemptListener(AttemptListener listener) {
      this.attemptListener = listener;
      return this;
    }

    /** Use an externally managed scheduler; {@link RetryExecutor#close()} will leave it running. */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public Builder schedulerThreads(int threads) {
      this.schedulerThreads = Math.max(1, threads);
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }
}
