package com.adlanda.codecontext.service;

import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.health.EmbeddingHealthIndicator;
import com.adlanda.codecontext.model.EmbeddingRunSummary;
import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service responsible for attaching embedding vectors to the fragments of uploaded files.
 *
 * A failed fragment is skipped and keeps whatever vector it had; a failed file
 * is skipped and the rest of the session continues. Runs on the same file are
 * serialized, different files are processed in parallel. Only the fragment list
 * is written back, so a session reassignment during a run is kept.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    // Fixed stripes keyed by file id hash; two files may share a stripe
    private static final int LOCK_STRIPES = 64;

    private final SourceFileStore fileStore;
    private final ExecutorService sessionExecutor;
    private final EmbeddingHealthIndicator healthIndicator;
    private final ReentrantLock[] fileLocks = new ReentrantLock[LOCK_STRIPES];

    public EmbeddingService(SourceFileStore fileStore,
                            @Qualifier("sessionEmbeddingExecutor") ExecutorService sessionExecutor,
                            EmbeddingHealthIndicator healthIndicator) {
        this.fileStore = fileStore;
        this.sessionExecutor = sessionExecutor;
        this.healthIndicator = healthIndicator;
        for (int i = 0; i < fileLocks.length; i++) {
            fileLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Generates embeddings for every fragment of a file and saves the file.
     *
     * @param fileId   The file to process
     * @param provider Credential-scoped embedding provider
     * @return Number of fragments embedded in this run
     * @throws SourceFileNotFoundException if the file does not exist
     */
    public int generateEmbeddingsForFile(String fileId, EmbeddingProvider provider) {
        ReentrantLock lock = fileLocks[stripeOf(fileId)];
        lock.lock();
        try {
            // Re-read under the lock so a concurrent run's vectors are not overwritten with stale data
            SourceFile file = fileStore.findById(fileId)
                    .orElseThrow(() -> new SourceFileNotFoundException(fileId));
            return embedAndSave(file, provider);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Generates embeddings for all files of a session on the session worker pool.
     *
     * @param sessionId The session whose files are processed
     * @param provider  Credential-scoped embedding provider
     * @return Counts of processed and failed files and embedded fragments
     */
    public EmbeddingRunSummary generateEmbeddingsForSession(String sessionId, EmbeddingProvider provider) {
        List<SourceFile> files = fileStore.listFilesForSession(sessionId);
        log.info("Generating embeddings for {} files in session {}", files.size(), sessionId);

        Map<String, Future<Integer>> tasks = new LinkedHashMap<>();
        for (SourceFile file : files) {
            tasks.put(file.id(), sessionExecutor.submit(() -> generateEmbeddingsForFile(file.id(), provider)));
        }

        BestEffortResult<SourceFile, Integer> result = BestEffort.map(files, file -> await(tasks.get(file.id())));

        result.failures().forEach(failure ->
                log.warn("Failed to generate embeddings for file {}: {}",
                        failure.item().name(), failure.error().getMessage()));

        int fragmentsEmbedded = result.results().stream().mapToInt(Integer::intValue).sum();
        EmbeddingRunSummary summary = new EmbeddingRunSummary(
                sessionId, result.successes().size(), result.failures().size(), fragmentsEmbedded);
        healthIndicator.recordRun(summary);

        log.info("Completed embedding generation for session {}: {} files, {} failed, {} fragments",
                sessionId, summary.filesProcessed(), summary.filesFailed(), fragmentsEmbedded);
        return summary;
    }

    static int stripeOf(String fileId) {
        return Math.floorMod(fileId.hashCode(), LOCK_STRIPES);
    }

    private int embedAndSave(SourceFile file, EmbeddingProvider provider) {
        BestEffortResult<Fragment, EmbeddingVector> result =
                BestEffort.map(file.fragments(), fragment -> provider.embed(fragment.content()));

        if (result.hasFailures()) {
            result.failures().forEach(failure ->
                    log.warn("Failed to generate embedding for {} of {}: {}",
                            failure.item().id(), file.name(), failure.error().getMessage()));
        }

        Map<String, EmbeddingVector> vectors = new HashMap<>();
        result.successes().forEach(success -> vectors.put(success.item().id(), success.result()));

        List<Fragment> updated = file.fragments().stream()
                .map(fragment -> vectors.containsKey(fragment.id())
                        ? fragment.withEmbedding(vectors.get(fragment.id()))
                        : fragment)
                .toList();

        if (!fileStore.updateFragments(file.id(), updated)) {
            throw new SourceFileNotFoundException(file.id());
        }

        log.info("Generated {} of {} embeddings for file {}",
                vectors.size(), file.fragments().size(), file.name());
        return vectors.size();
    }

    private int await(Future<Integer> task) {
        try {
            return task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for embedding task", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(e.getCause());
        }
    }
}
