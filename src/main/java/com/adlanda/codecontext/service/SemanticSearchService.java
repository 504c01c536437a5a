package com.adlanda.codecontext.service;

import com.adlanda.codecontext.embedding.EmbeddingProvider;
import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.MatchResult;
import com.adlanda.codecontext.model.RankedMatch;
import com.adlanda.codecontext.model.SearchResponse;
import com.adlanda.codecontext.model.SourceFile;
import com.adlanda.codecontext.repository.SourceFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for semantic code search within a session.
 *
 * Unlike context assembly, search reports provider failures to the caller:
 * a search without vectors has no meaningful answer.
 */
@Service
public class SemanticSearchService {

    private static final Logger log = LoggerFactory.getLogger(SemanticSearchService.class);

    private final SourceFileStore fileStore;
    private final SimilarityRanker ranker;

    public SemanticSearchService(SourceFileStore fileStore, SimilarityRanker ranker) {
        this.fileStore = fileStore;
        this.ranker = ranker;
    }

    /**
     * Searches the session's fragments for the ones most similar to the query.
     *
     * @param query     The search text
     * @param sessionId The session whose files are searched
     * @param provider  Credential-scoped embedding provider
     * @param limit     Maximum number of results
     * @return The query and its ranked matches
     */
    public SearchResponse search(String query, String sessionId, EmbeddingProvider provider, int limit) {
        long startTime = System.currentTimeMillis();

        List<SourceFile> files = fileStore.listFilesForSession(sessionId);
        if (files.isEmpty()) {
            log.debug("Session {} has no files, nothing to search", sessionId);
            return new SearchResponse(query, List.of());
        }

        EmbeddingVector queryVector = provider.embed(query);
        List<RankedMatch> matches = ranker.findSimilar(queryVector, files, limit);

        log.debug("Search '{}' in session {} returned {} results in {}ms",
                truncate(query, 50), sessionId, matches.size(), System.currentTimeMillis() - startTime);

        return new SearchResponse(query, matches.stream().map(MatchResult::from).toList());
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
