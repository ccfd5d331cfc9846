package com.codurance.resilience.provider;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External - generates embedding vectors for text. Implementations fail their futures with
 * {@link ProviderException} on provider errors.
 */
public interface EmbeddingProvider {

    /** One vector per input text, in input order. */
    CompletableFuture<List<float[]>> embedTexts(List<String> texts);

    default CompletableFuture<float[]> embedText(String text) {
        return embedTexts(List.of(text)).thenApply(vectors -> vectors.get(0));
    }

    String modelName();
}
