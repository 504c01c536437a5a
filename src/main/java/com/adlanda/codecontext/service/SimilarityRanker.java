package com.adlanda.codecontext.service;

import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.RankedMatch;
import com.adlanda.codecontext.model.SourceFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exhaustive cosine-similarity ranking over the fragments of a set of files.
 *
 * Candidates are scoped to a single session, so every embedded fragment is
 * scored; there is no index.
 */
@Component
public class SimilarityRanker {

    /**
     * Scores every embedded fragment against the query and returns the best ones.
     *
     * Fragments without a vector are not candidates. Equal scores keep input
     * order (file order, then fragment order).
     *
     * @param queryVector The query embedding
     * @param files       Files whose fragments are candidates
     * @param limit       Maximum number of matches
     * @return Matches sorted by descending similarity, at most {@code limit}
     */
    public List<RankedMatch> findSimilar(EmbeddingVector queryVector, List<SourceFile> files, int limit) {
        if (queryVector == null || limit <= 0) {
            return List.of();
        }

        List<RankedMatch> scored = new ArrayList<>();
        for (SourceFile file : files) {
            for (Fragment fragment : file.fragments()) {
                if (fragment.hasEmbedding()) {
                    scored.add(new RankedMatch(file, fragment, cosineSimilarity(queryVector, fragment.embedding())));
                }
            }
        }

        // List.sort is stable, which keeps ties in input order
        scored.sort(Comparator.comparingDouble(RankedMatch::similarity).reversed());

        return List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return Similarity in [-1, 1]; exactly 0 when the dimensions differ,
     *         either vector has zero magnitude or a component is not finite
     */
    public static double cosineSimilarity(EmbeddingVector a, EmbeddingVector b) {
        List<Double> x = a.values();
        List<Double> y = b.values();
        if (x.size() != y.size() || x.isEmpty()) {
            return 0.0;
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < x.size(); i++) {
            double xi = x.get(i);
            double yi = y.get(i);
            dotProduct += xi * yi;
            normA += xi * xi;
            normB += yi * yi;
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        double similarity = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        if (!Double.isFinite(similarity)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, similarity));
    }
}
