package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.model.EmbeddingVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeLimitedEmbeddingProviderTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void embed_fastDelegate_returnsItsVector() {
        EmbeddingProvider provider = new TimeLimitedEmbeddingProvider(
                text -> EmbeddingVector.of(text.length()), executor, Duration.ofSeconds(5));

        assertThat(provider.embed("abc")).isEqualTo(EmbeddingVector.of(3));
    }

    @Test
    void embed_hungDelegate_failsAfterTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        EmbeddingProvider provider = new TimeLimitedEmbeddingProvider(text -> {
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return EmbeddingVector.of(1);
        }, executor, Duration.ofMillis(50));

        long start = System.nanoTime();
        assertThatThrownBy(() -> provider.embed("slow"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void embed_delegateProviderException_isRethrownUnchanged() {
        ProviderException failure = new ProviderException("quota exceeded");
        EmbeddingProvider provider = new TimeLimitedEmbeddingProvider(text -> {
            throw failure;
        }, executor, Duration.ofSeconds(5));

        assertThatThrownBy(() -> provider.embed("x")).isSameAs(failure);
    }

    @Test
    void embed_delegateUnexpectedException_isWrapped() {
        EmbeddingProvider provider = new TimeLimitedEmbeddingProvider(text -> {
            throw new IllegalArgumentException("bad input");
        }, executor, Duration.ofSeconds(5));

        assertThatThrownBy(() -> provider.embed("x"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("bad input")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
