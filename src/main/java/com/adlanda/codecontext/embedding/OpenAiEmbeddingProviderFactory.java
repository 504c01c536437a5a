package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.config.EmbeddingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;

import java.util.concurrent.ExecutorService;

/**
 * Creates OpenAI-backed providers for the API key supplied with each request.
 *
 * Calls are attempted once and bounded by the configured call timeout.
 */
public class OpenAiEmbeddingProviderFactory implements EmbeddingProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProviderFactory.class);

    private final EmbeddingProperties properties;
    private final ExecutorService callExecutor;

    public OpenAiEmbeddingProviderFactory(EmbeddingProperties properties, ExecutorService callExecutor) {
        this.properties = properties;
        this.callExecutor = callExecutor;
    }

    @Override
    public EmbeddingProvider create(String credential) {
        if (!StringUtils.hasText(credential)) {
            throw new ProviderException("An API key is required to create an embedding provider");
        }

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(properties.getBaseUrl())
                .apiKey(credential)
                .build();

        OpenAiEmbeddingOptions options = OpenAiEmbeddingOptions.builder()
                .model(properties.getModel())
                .build();

        RetryTemplate singleAttempt = RetryTemplate.builder()
                .maxAttempts(1)
                .build();

        OpenAiEmbeddingModel model = new OpenAiEmbeddingModel(api, MetadataMode.EMBED, options, singleAttempt);
        log.debug("Created OpenAI embedding provider for model {}", properties.getModel());

        return new TimeLimitedEmbeddingProvider(
                new SpringAiEmbeddingProvider(model), callExecutor, properties.getCallTimeout());
    }
}
