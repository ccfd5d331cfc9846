package com.codurance.resilience.provider;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External - chat completion. Implementations fail their futures with {@link ProviderException}
 * on provider errors.
 */
public interface ChatProvider {

    /**
     * @param systemPrompt optional system instructions, may be null
     */
    CompletableFuture<ChatResponse> chat(List<ChatMessage> messages, String systemPrompt);

    String modelName();
}
