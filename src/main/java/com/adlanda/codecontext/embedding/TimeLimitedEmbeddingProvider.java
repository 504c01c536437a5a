package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.model.EmbeddingVector;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call of a delegate provider by a deadline so a hung upstream
 * cannot block a request. A call past the deadline is cancelled and reported
 * as a {@link ProviderException}.
 */
public class TimeLimitedEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeLimitedEmbeddingProvider(EmbeddingProvider delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public EmbeddingVector embed(String text) {
        Future<EmbeddingVector> call = executor.submit(() -> delegate.embed(text));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProviderException("Embedding call timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for embedding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException providerException) {
                throw providerException;
            }
            throw new ProviderException("Embedding call failed: " + cause.getMessage(), cause);
        }
    }
}
