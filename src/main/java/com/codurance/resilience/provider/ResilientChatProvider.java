package com.codurance.resilience.provider;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.codurance.resilience.RetryExecutor;
import com.codurance.resilience.reliability.RetryPolicy;

/**
 * Routes every chat completion through a {@link RetryExecutor}.
 */
public class ResilientChatProvider implements ChatProvider {
    private final ChatProvider delegate;
    private final RetryExecutor executor;
    private final RetryPolicy policy;

    public ResilientChatProvider(ChatProvider delegate, RetryExecutor executor) {
        this(delegate, executor, ProviderPolicies.chat());
    }

    public ResilientChatProvider(ChatProvider delegate, RetryExecutor executor, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public CompletableFuture<ChatResponse> chat(List<ChatMessage> messages, String systemPrompt) {
        List<ChatMessage> copy = List.copyOf(messages);
        return executor.run("chat", () -> delegate.chat(copy, systemPrompt), policy);
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }
}
