package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.model.EmbeddingVector;

/**
 * Converts text into an embedding vector.
 *
 * Instances are credential-scoped and created per request through an
 * {@link EmbeddingProviderFactory}. Callers must treat every failure as
 * non-retryable.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Creates an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding vector
     * @throws ProviderException if the upstream call fails or times out
     */
    EmbeddingVector embed(String text);
}
