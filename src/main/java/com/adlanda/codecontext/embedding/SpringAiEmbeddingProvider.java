package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.model.EmbeddingVector;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.List;

/**
 * Embedding provider backed by a Spring AI {@link EmbeddingModel}.
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public EmbeddingVector embed(String text) {
        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(List.of(text));
        } catch (RuntimeException e) {
            throw new ProviderException("Embedding request failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null) {
            throw new ProviderException("Embedding response contained no result");
        }
        float[] output = response.getResult().getOutput();
        if (output == null || output.length == 0) {
            throw new ProviderException("Embedding response contained an empty vector");
        }
        return EmbeddingVector.of(output);
    }
}
