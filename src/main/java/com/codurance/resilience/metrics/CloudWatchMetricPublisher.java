package com.codurance.resilience.metrics;

import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codurance.resilience.reliability.CircuitBreakerState;

/**
 * Minimal CloudWatch MetricPublisher. Each event is one PutMetricData request with the
 * metric labels sent as dimensions. For production use, consider batching to avoid
 * throttling and cost.
 */
public class CloudWatchMetricPublisher implements MetricPublisher {
  public static final String DEFAULT_NAMESPACE = "AIResilience";
  public static final String RETRIES = "Retries";
  public static final String STATE_CHANGES = "CircuitBreakerStateChanges";
  public static final String OPEN_DURATION = "CircuitBreakerOpenDuration";

  private final CloudWatchClient client;
  private final String namespace;
  private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricPublisher.class);

  public CloudWatchMetricPublisher(CloudWatchClient client, String namespace) {
    this.client = client;
    this.namespace = namespace == null ? DEFAULT_NAMESPACE : namespace;
  }

  @Override
  public void incrementRetry(String operation, int attempt, String circuitBreaker) {
    publishMetric(RETRIES, 1.0, StandardUnit.COUNT,
        dimension("Operation", operation),
        dimension("Attempt", String.valueOf(attempt)),
        dimension("CircuitBreaker", circuitBreaker == null ? NO_CIRCUIT_BREAKER : circuitBreaker));
  }

  @Override
  public void incrementStateChange(String circuitBreaker, CircuitBreakerState from, CircuitBreakerState to) {
    publishMetric(STATE_CHANGES, 1.0, StandardUnit.COUNT,
        dimension("CircuitBreaker", circuitBreaker),
        dimension("FromState", from.label()),
        dimension("ToState", to.label()));
  }

  @Override
  public void observeOpenDuration(String circuitBreaker, double seconds) {
    publishMetric(OPEN_DURATION, seconds, StandardUnit.SECONDS, dimension("CircuitBreaker", circuitBreaker));
  }

  private static Dimension dimension(String name, String value) {
    return Dimension.builder().name(name).value(value).build();
  }

  private void publishMetric(String name, double value, StandardUnit unit, Dimension... dimensions) {
    try {
      MetricDatum datum = MetricDatum.builder()
          .metricName(name)
          .value(value)
          .unit(unit)
          .dimensions(dimensions)
          .build();
      List<MetricDatum> data = new ArrayList<>();
      data.add(datum);
      PutMetricDataRequest req = PutMetricDataRequest.builder()
          .namespace(this.namespace)
          .metricData(data)
          .build();
      client.putMetricData(req);
    } catch (Throwable t) {
      // best-effort; do not throw from metrics
      logger.warn("Failed to publish CloudWatch metric {}", name, t);
    }
  }
}
