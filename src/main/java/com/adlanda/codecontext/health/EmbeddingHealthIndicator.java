package com.adlanda.codecontext.health;

import com.adlanda.codecontext.model.EmbeddingRunSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for embedding generation.
 *
 * Reports the last session embedding run. Embeddings are an optional
 * enhancement, so failed files degrade the status to UNKNOWN rather than DOWN:
 * chat keeps working without vector search.
 */
@Component
public class EmbeddingHealthIndicator implements HealthIndicator {

    private final AtomicReference<RunState> state = new AtomicReference<>(new RunState(null, null));

    /**
     * Records the outcome of a session embedding run.
     */
    public void recordRun(EmbeddingRunSummary summary) {
        state.set(new RunState(summary, Instant.now()));
    }

    @Override
    public Health health() {
        RunState current = state.get();

        if (current.summary() == null) {
            return Health.up()
                    .withDetail("lastRun", "never")
                    .build();
        }

        EmbeddingRunSummary summary = current.summary();
        Health.Builder builder = summary.filesFailed() == 0 ? Health.up() : Health.unknown();
        return builder
                .withDetail("lastRun", current.timestamp().toString())
                .withDetail("sessionId", summary.sessionId())
                .withDetail("filesProcessed", summary.filesProcessed())
                .withDetail("filesFailed", summary.filesFailed())
                .withDetail("fragmentsEmbedded", summary.fragmentsEmbedded())
                .build();
    }

    /**
     * Internal state holder for thread-safe health updates.
     */
    private record RunState(EmbeddingRunSummary summary, Instant timestamp) {}
}
