package com.adlanda.codecontext.service;

import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.embedding.ProviderException;
import com.adlanda.codecontext.health.EmbeddingHealthIndicator;
import com.adlanda.codecontext.model.EmbeddingRunSummary;
import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.FragmentKind;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    private static final String SESSION = "session-1";

    @Mock
    private SourceFileStore fileStore;

    @Captor
    private ArgumentCaptor<List<Fragment>> fragmentsCaptor;

    private ExecutorService executor;
    private EmbeddingHealthIndicator healthIndicator;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        healthIndicator = new EmbeddingHealthIndicator();
        embeddingService = new EmbeddingService(fileStore, executor, healthIndicator);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void generateEmbeddingsForFile_embedsEveryFragmentAndSaves() {
        SourceFile file = file("f1", fragment("chunk_1", "one", null), fragment("chunk_2", "two", null));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        int embedded = embeddingService.generateEmbeddingsForFile("f1", text -> EmbeddingVector.of(1, 2, 3));

        assertThat(embedded).isEqualTo(2);
        List<Fragment> saved = captureSavedFragments("f1");
        assertThat(saved).allMatch(Fragment::hasEmbedding);
        assertThat(saved.get(0).embedding()).isEqualTo(EmbeddingVector.of(1, 2, 3));
    }

    @Test
    void generateEmbeddingsForFile_failingFragmentIsSkipped() {
        SourceFile file = file("f1",
                fragment("chunk_1", "good one", null),
                fragment("chunk_2", "bad", null),
                fragment("chunk_3", "good two", null));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        EmbeddingProvider provider = text -> {
            if (text.equals("bad")) {
                throw new ProviderException("rate limited");
            }
            return EmbeddingVector.of(0.5, 0.5);
        };

        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        int embedded = embeddingService.generateEmbeddingsForFile("f1", provider);

        assertThat(embedded).isEqualTo(2);
        List<Fragment> fragments = captureSavedFragments("f1");
        assertThat(fragments).extracting(Fragment::hasEmbedding).containsExactly(true, false, true);
        assertThat(fragments).extracting(Fragment::id).containsExactly("chunk_1", "chunk_2", "chunk_3");
    }

    @Test
    void generateEmbeddingsForFile_failedFragmentKeepsPreviousVector() {
        EmbeddingVector previous = EmbeddingVector.of(9, 9);
        SourceFile file = file("f1", fragment("chunk_1", "text", previous));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        int embedded = embeddingService.generateEmbeddingsForFile("f1", text -> {
            throw new ProviderException("invalid key");
        });

        assertThat(embedded).isZero();
        assertThat(captureSavedFragments("f1").get(0).embedding()).isEqualTo(previous);
    }

    @Test
    void generateEmbeddingsForFile_unknownFile_throwsNotFound() {
        when(fileStore.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> embeddingService.generateEmbeddingsForFile("missing", text -> EmbeddingVector.of(1)))
                .isInstanceOf(SourceFileNotFoundException.class)
                .hasMessageContaining("missing");
        verify(fileStore, never()).updateFragments(anyString(), anyList());
    }

    @Test
    void generateEmbeddingsForFile_fileRemovedDuringRun_throwsNotFound() {
        SourceFile file = file("f1", fragment("chunk_1", "a", null));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        when(fileStore.updateFragments(eq("f1"), anyList())).thenReturn(false);

        assertThatThrownBy(() -> embeddingService.generateEmbeddingsForFile("f1", text -> EmbeddingVector.of(1)))
                .isInstanceOf(SourceFileNotFoundException.class);
    }

    @Test
    void generateEmbeddingsForFile_neverRewritesTheWholeRecord() {
        SourceFile file = file("f1", fragment("chunk_1", "a", null));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        when(fileStore.updateFragments(eq("f1"), anyList())).thenReturn(true);

        embeddingService.generateEmbeddingsForFile("f1", text -> EmbeddingVector.of(1));

        verify(fileStore, never()).saveFile(any());
    }

    @Test
    void generateEmbeddingsForFile_concurrentRunsOnSameFileAreSerialized() throws Exception {
        SourceFile file = file("f1", fragment("chunk_1", "a", null), fragment("chunk_2", "b", null));
        when(fileStore.findById("f1")).thenReturn(Optional.of(file));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        EmbeddingProvider provider = text -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return EmbeddingVector.of(1, 0);
        };

        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> runs = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                runs.add(callers.submit(() -> embeddingService.generateEmbeddingsForFile("f1", provider)));
            }
            for (Future<Integer> run : runs) {
                assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(2);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        verify(fileStore, times(4)).updateFragments(eq("f1"), anyList());
    }

    @Test
    void generateEmbeddingsForSession_failingFileDoesNotStopOthers() {
        SourceFile healthy = file("f1", fragment("chunk_1", "a", null), fragment("chunk_2", "b", null));
        SourceFile broken = file("f2", fragment("chunk_1", "c", null));
        when(fileStore.listFilesForSession(SESSION)).thenReturn(List.of(healthy, broken));
        when(fileStore.findById("f1")).thenReturn(Optional.of(healthy));
        when(fileStore.findById("f2")).thenThrow(new DataAccessResourceFailureException("db down"));
        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        EmbeddingRunSummary summary = embeddingService.generateEmbeddingsForSession(SESSION, text -> EmbeddingVector.of(1, 0));

        assertThat(summary.sessionId()).isEqualTo(SESSION);
        assertThat(summary.filesProcessed()).isEqualTo(1);
        assertThat(summary.filesFailed()).isEqualTo(1);
        assertThat(summary.fragmentsEmbedded()).isEqualTo(2);
        assertThat(captureSavedFragments("f1")).hasSize(2);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    void generateEmbeddingsForSession_allFilesSucceed_reportsHealthy() {
        SourceFile first = file("f1", fragment("chunk_1", "a", null));
        SourceFile second = file("f2", fragment("chunk_1", "b", null), fragment("chunk_2", "c", null));
        when(fileStore.listFilesForSession(SESSION)).thenReturn(List.of(first, second));
        when(fileStore.findById("f1")).thenReturn(Optional.of(first));
        when(fileStore.findById("f2")).thenReturn(Optional.of(second));
        when(fileStore.updateFragments(anyString(), anyList())).thenReturn(true);

        EmbeddingRunSummary summary = embeddingService.generateEmbeddingsForSession(SESSION, text -> EmbeddingVector.of(1));

        assertThat(summary.filesProcessed()).isEqualTo(2);
        assertThat(summary.filesFailed()).isZero();
        assertThat(summary.fragmentsEmbedded()).isEqualTo(3);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(healthIndicator.health().getDetails()).containsEntry("fragmentsEmbedded", 3);
    }

    @Test
    void generateEmbeddingsForSession_noFiles_returnsEmptySummary() {
        when(fileStore.listFilesForSession(SESSION)).thenReturn(List.of());

        EmbeddingRunSummary summary = embeddingService.generateEmbeddingsForSession(SESSION, text -> EmbeddingVector.of(1));

        assertThat(summary.filesProcessed()).isZero();
        assertThat(summary.fragmentsEmbedded()).isZero();
        verify(fileStore, never()).updateFragments(anyString(), anyList());
    }

    @Test
    void stripeOf_staysWithinFixedLockTable() {
        // Hash code of this string is Integer.MIN_VALUE
        assertThat(EmbeddingService.stripeOf("polygenelubricants")).isBetween(0, 63);
        for (int i = 0; i < 10_000; i++) {
            assertThat(EmbeddingService.stripeOf(UUID.randomUUID().toString())).isBetween(0, 63);
        }
        assertThat(EmbeddingService.stripeOf("f1")).isEqualTo(EmbeddingService.stripeOf("f1"));
    }

    private List<Fragment> captureSavedFragments(String fileId) {
        verify(fileStore).updateFragments(eq(fileId), fragmentsCaptor.capture());
        return fragmentsCaptor.getValue();
    }

    private static Fragment fragment(String id, String content, EmbeddingVector embedding) {
        return new Fragment(id, content, 1, 1, FragmentKind.BLOCK, embedding);
    }

    private static SourceFile file(String id, Fragment... fragments) {
        return new SourceFile(id, SESSION, id + ".py", "python", "content",
                List.of(fragments), List.of(), List.of(), Instant.now());
    }
}
