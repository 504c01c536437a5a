package com.adlanda.codecontext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for embedding generation.
 *
 * Maps to properties prefixed with 'codecontext.embedding' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "codecontext.embedding")
public class EmbeddingProperties {

    /**
     * Which provider backs embeddings: "openai" or "deterministic".
     * The deterministic provider needs no credential and is meant for local runs and tests.
     */
    private String provider = "openai";

    /**
     * Embedding model requested from OpenAI.
     */
    private String model = "text-embedding-3-small";

    private String baseUrl = "https://api.openai.com";

    /**
     * Upper bound for a single embedding call. A call past this deadline counts as failed.
     */
    private Duration callTimeout = Duration.ofSeconds(10);

    /**
     * Number of files embedded concurrently when a whole session is processed.
     */
    private int sessionParallelism = 4;

    /**
     * Vector size of the deterministic provider.
     */
    private int dimensions = 256;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public int getSessionParallelism() {
        return sessionParallelism;
    }

    public void setSessionParallelism(int sessionParallelism) {
        this.sessionParallelism = sessionParallelism;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }
}
