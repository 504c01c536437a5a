package com.adlanda.codecontext.health;

import com.adlanda.codecontext.model.EmbeddingRunSummary;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingHealthIndicatorTest {

    private final EmbeddingHealthIndicator indicator = new EmbeddingHealthIndicator();

    @Test
    void health_beforeAnyRun_isUp() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("lastRun", "never");
    }

    @Test
    void health_afterRunWithFailedFiles_isUnknown() {
        indicator.recordRun(new EmbeddingRunSummary("s1", 4, 2, 30));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails())
                .containsEntry("sessionId", "s1")
                .containsEntry("filesFailed", 2);
    }

    @Test
    void health_latestRunWins() {
        indicator.recordRun(new EmbeddingRunSummary("s1", 1, 1, 0));
        indicator.recordRun(new EmbeddingRunSummary("s2", 3, 0, 12));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("sessionId", "s2");
    }
}
