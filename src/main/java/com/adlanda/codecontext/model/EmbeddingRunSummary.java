package com.adlanda.codecontext.model;

/**
 * Outcome of generating embeddings for all files of a session.
 *
 * @param sessionId           The session processed
 * @param filesProcessed      Files whose embedding run completed
 * @param filesFailed         Files that failed and were skipped
 * @param fragmentsEmbedded   Fragments that received a vector in this run
 */
public record EmbeddingRunSummary(
        String sessionId,
        int filesProcessed,
        int filesFailed,
        int fragmentsEmbedded
) {}
