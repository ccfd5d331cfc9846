package com.codurance.resilience.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.resilience.reliability.CircuitBreakerState;

/**
 * Prometheus-backed MetricPublisher. Counter increments are buffered per label set and pushed
 * into the Prometheus counters once a second, so hot retry paths only touch an AtomicLong.
 * Histogram observations go straight through.
 */
public class PrometheusMetricPublisher implements MetricPublisher, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricPublisher.class);
  public static final String DEFAULT_NAMESPACE = "ai";

  private final CollectorRegistry registry;
  private final Counter retries;
  private final Counter stateChanges;
  private final Histogram openDuration;
  private final ConcurrentHashMap<List<String>, AtomicLong> bufferedRetries = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<List<String>, AtomicLong> bufferedStateChanges = new ConcurrentHashMap<>();
  private final ScheduledExecutorService scheduler;

  public PrometheusMetricPublisher(CollectorRegistry registry, String namespace) {
    this.registry = registry == null ? CollectorRegistry.defaultRegistry : registry;
    String ns = namespace == null ? DEFAULT_NAMESPACE : namespace;

    this.retries = Counter.build()
        .namespace(ns)
        .name("retries_total")
        .help("Total retry attempts across all AI operations")
        .labelNames("operation", "attempt", "circuit_breaker")
        .register(this.registry);

    this.stateChanges = Counter.build()
        .namespace(ns)
        .name("circuit_breaker_state_changes_total")
        .help("Total circuit breaker state transitions")
        .labelNames("circuit_breaker", "from_state", "to_state")
        .register(this.registry);

    this.openDuration = Histogram.build()
        .namespace(ns)
        .name("circuit_breaker_open_duration_seconds")
        .help("Duration circuit breaker remains in open state")
        .labelNames("circuit_breaker")
        .buckets(1, 5, 10, 30, 60, 120, 300)
        .register(this.registry);

    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "prometheus-metric-flusher");
      t.setDaemon(true);
      return t;
    });
    this.scheduler.scheduleAtFixedRate(this::flushBuffersSafely, 1, 1, TimeUnit.SECONDS);
  }

  public CollectorRegistry getRegistry() {
    return registry;
  }

  @Override
  public void incrementRetry(String operation, int attempt, String circuitBreaker) {
    buffer(bufferedRetries, List.of(operation, String.valueOf(attempt),
        circuitBreaker == null ? NO_CIRCUIT_BREAKER : circuitBreaker));
  }

  @Override
  public void incrementStateChange(String circuitBreaker, CircuitBreakerState from, CircuitBreakerState to) {
    buffer(bufferedStateChanges, List.of(circuitBreaker, from.label(), to.label()));
  }

  @Override
  public void observeOpenDuration(String circuitBreaker, double seconds) {
    try {
      openDuration.labels(circuitBreaker).observe(seconds);
    } catch (RuntimeException e) {
      logger.warn("Failed to observe open duration for {}", circuitBreaker, e);
    }
  }

  @Override
  public void flush() {
    drain(bufferedRetries, retries);
    drain(bufferedStateChanges, stateChanges);
  }

  @Override
  public void close() {
    try {
      scheduler.shutdown();
      scheduler.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    // flush remaining
    flush();
  }

  private static void buffer(ConcurrentHashMap<List<String>, AtomicLong> buffer, List<String> labels) {
    buffer.computeIfAbsent(labels, k -> new AtomicLong()).incrementAndGet();
  }

  private static void drain(ConcurrentHashMap<List<String>, AtomicLong> buffer, Counter counter) {
    for (Map.Entry<List<String>, AtomicLong> entry : buffer.entrySet()) {
      long delta = entry.getValue().getAndSet(0);
      if (delta > 0)
        counter.labels(entry.getKey().toArray(new String[0])).inc(delta);
    }
  }

  private void flushBuffersSafely() {
    try {
      flush();
    } catch (Throwable t) {
      logger.warn("Error flushing Prometheus buffers", t);
    }
  }
}
