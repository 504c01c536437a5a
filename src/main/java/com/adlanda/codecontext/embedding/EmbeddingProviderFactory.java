package com.adlanda.codecontext.embedding;

/**
 * Builds an {@link EmbeddingProvider} bound to a caller-supplied credential.
 */
@FunctionalInterface
public interface EmbeddingProviderFactory {

    EmbeddingProvider create(String credential);
}
