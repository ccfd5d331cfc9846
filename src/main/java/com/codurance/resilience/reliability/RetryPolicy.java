package com.codurance.resilience.reliability;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Backoff settings plus the rules deciding which failures are worth retrying and which
 * circuit breaker, if any, guards the call.
 */
public class RetryPolicy {
    private final BackoffPolicy backoff;
    private final Predicate<Throwable> retryable;
    private final String circuitBreakerName;
    private final CircuitBreakerConfig circuitBreakerConfig;

    private RetryPolicy(Builder builder) {
        this.backoff = Objects.requireNonNull(builder.backoff, "backoff");
        this.retryable = builder.buildClassifier();
        this.circuitBreakerName = builder.circuitBreakerName;
        this.circuitBreakerConfig = Objects.requireNonNull(builder.circuitBreakerConfig, "circuitBreakerConfig");
    }

    public static Builder builder() {
        return new Builder();
    }

    public BackoffPolicy getBackoff() { return backoff; }
    public Optional<String> getCircuitBreakerName() { return Optional.ofNullable(circuitBreakerName); }
    public CircuitBreakerConfig getCircuitBreakerConfig() { return circuitBreakerConfig; }

    public boolean isRetryable(Throwable error) {
        return error != null && retryable.test(error);
    }

    public static class Builder {
        private BackoffPolicy backoff = BackoffPolicy.defaults();
        private final List<Class<? extends Throwable>> retryOn = new ArrayList<>();
        private Predicate<Throwable> retryIf;
        private String circuitBreakerName;
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaults();

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        /** Failures that are instances of any of these types are retried. */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            for (Class<? extends Throwable> type : types)
                retryOn.add(Objects.requireNonNull(type, "type"));
            return this;
        }

        /** Failures matching this predicate are retried, in addition to any {@link #retryOn} types. */
        public Builder retryIf(Predicate<Throwable> predicate) {
            this.retryIf = Objects.requireNonNull(predicate, "predicate");
            return this;
        }

        public Builder circuitBreaker(String name) {
            this.circuitBreakerName = name;
            return this;
        }

        public Builder circuitBreaker(String name, CircuitBreakerConfig config) {
            this.circuitBreakerName = name;
            this.circuitBreakerConfig = config;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }

        private Predicate<Throwable> buildClassifier() {
            if (retryOn.isEmpty() && retryIf == null)
                return Exception.class::isInstance;

            List<Class<? extends Throwable>> types = List.copyOf(retryOn);
            Predicate<Throwable> byType = e -> types.stream().anyMatch(t -> t.isInstance(e));
            return retryIf == null ? byType : byType.or(retryIf);
        }
    }
}
