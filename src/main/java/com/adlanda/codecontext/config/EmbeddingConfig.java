package com.adlanda.codecontext.config;

import com.adlanda.codecontext.embedding.DeterministicEmbeddingProvider;
import com.adlanda.codecontext.embedding.EmbeddingProviderFactory;
import com.adlanda.codecontext.embedding.OpenAiEmbeddingProviderFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the embedding provider factory and the executors used for embedding work.
 *
 * Session-level work and individual provider calls run on separate pools so a
 * file task waiting on a call can never starve the call itself.
 */
@Configuration
public class EmbeddingConfig {

    @Bean(destroyMethod = "shutdown")
    @Qualifier("sessionEmbeddingExecutor")
    public ExecutorService sessionEmbeddingExecutor(EmbeddingProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getSessionParallelism()));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("embeddingCallExecutor")
    public ExecutorService embeddingCallExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    @ConditionalOnProperty(name = "codecontext.embedding.provider", havingValue = "openai", matchIfMissing = true)
    public EmbeddingProviderFactory openAiEmbeddingProviderFactory(
            EmbeddingProperties properties,
            @Qualifier("embeddingCallExecutor") ExecutorService embeddingCallExecutor) {
        return new OpenAiEmbeddingProviderFactory(properties, embeddingCallExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "codecontext.embedding.provider", havingValue = "deterministic")
    @ConditionalOnMissingBean
    public EmbeddingProviderFactory deterministicEmbeddingProviderFactory(EmbeddingProperties properties) {
        DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(properties.getDimensions());
        return credential -> provider;
    }
}
