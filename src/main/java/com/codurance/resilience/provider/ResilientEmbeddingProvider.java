package com.codurance.resilience.provider;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.codurance.resilience.RetryExecutor;
import com.codurance.resilience.reliability.RetryPolicy;

/**
 * Routes every embedding call through a {@link RetryExecutor}.
 */
public class ResilientEmbeddingProvider implements EmbeddingProvider {
    private final EmbeddingProvider delegate;
    private final RetryExecutor executor;
    private final RetryPolicy policy;

    public ResilientEmbeddingProvider(EmbeddingProvider delegate, RetryExecutor executor) {
        this(delegate, executor, ProviderPolicies.embedding());
    }

    public ResilientEmbeddingProvider(EmbeddingProvider delegate, RetryExecutor executor, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public CompletableFuture<List<float[]>> embedTexts(List<String> texts) {
        List<String> copy = List.copyOf(texts);
        return executor.run("embed_texts", () -> delegate.embedTexts(copy), policy);
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }
}
