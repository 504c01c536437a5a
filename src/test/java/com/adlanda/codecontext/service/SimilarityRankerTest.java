package com.adlanda.codecontext.service;

import com.adlanda.codecontext.model.EmbeddingVector;
import com.adlanda.codecontext.model.Fragment;
import com.adlanda.codecontext.model.FragmentKind;
import com.adlanda.codecontext.model.RankedMatch;
import com.adlanda.codecontext.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityRankerTest {

    private SimilarityRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new SimilarityRanker();
    }

    @Test
    void findSimilar_returnsTopMatchesInDescendingOrder() {
        SourceFile file = file("f1",
                fragment("same", EmbeddingVector.of(1, 0)),
                fragment("orthogonal", EmbeddingVector.of(0, 1)),
                fragment("opposite", EmbeddingVector.of(-1, 0)));

        List<RankedMatch> matches = ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(file), 2);

        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).fragment().id()).isEqualTo("same");
        assertThat(matches.get(0).similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(matches.get(1).fragment().id()).isEqualTo("orthogonal");
        assertThat(matches.get(1).similarity()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void findSimilar_tiesKeepInsertionOrder() {
        EmbeddingVector half = EmbeddingVector.of(1, Math.sqrt(3));
        SourceFile first = file("file1", fragment("frag1", half));
        SourceFile second = file("file2", fragment("frag2", half));

        List<RankedMatch> matches = ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(first, second), 10);

        assertThat(matches).extracting(m -> m.file().id()).containsExactly("file1", "file2");
        assertThat(matches.get(0).similarity()).isCloseTo(0.5, within(1e-9));

        List<RankedMatch> reversed = ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(second, first), 10);

        assertThat(reversed).extracting(m -> m.file().id()).containsExactly("file2", "file1");
    }

    @Test
    void findSimilar_fragmentsWithoutVectorsAreNotCandidates() {
        SourceFile file = file("f1",
                fragment("embedded", EmbeddingVector.of(0.2, 0.8)),
                fragment("pending", null));

        List<RankedMatch> matches = ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(file), 10);

        assertThat(matches).extracting(m -> m.fragment().id()).containsExactly("embedded");
    }

    @Test
    void findSimilar_emptyCandidateSet_returnsNoMatches() {
        assertThat(ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(), 5)).isEmpty();
        assertThat(ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(file("f1")), 5)).isEmpty();
    }

    @Test
    void findSimilar_nonPositiveLimit_returnsNoMatches() {
        SourceFile file = file("f1", fragment("a", EmbeddingVector.of(1, 0)));

        assertThat(ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(file), 0)).isEmpty();
    }

    @Test
    void findSimilar_randomCandidates_sortedAndBoundedByLimit() {
        Random random = new Random(42);
        List<SourceFile> files = new ArrayList<>();
        for (int f = 0; f < 5; f++) {
            List<Fragment> fragments = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                fragments.add(fragment("f" + f + "-" + i, randomVector(random, 8)));
            }
            files.add(file("file" + f, fragments.toArray(Fragment[]::new)));
        }

        for (int limit : new int[]{1, 10, 35, 100}) {
            List<RankedMatch> matches = ranker.findSimilar(randomVector(random, 8), files, limit);

            assertThat(matches).hasSize(Math.min(limit, 35));
            for (int i = 1; i < matches.size(); i++) {
                assertThat(matches.get(i).similarity()).isLessThanOrEqualTo(matches.get(i - 1).similarity());
            }
        }
    }

    @Test
    void cosineSimilarity_mismatchedDimensions_isZero() {
        assertThat(SimilarityRanker.cosineSimilarity(EmbeddingVector.of(1, 0), EmbeddingVector.of(1, 0, 0)))
                .isEqualTo(0.0);
    }

    @Test
    void cosineSimilarity_zeroMagnitude_isZero() {
        assertThat(SimilarityRanker.cosineSimilarity(EmbeddingVector.of(0, 0), EmbeddingVector.of(1, 1)))
                .isEqualTo(0.0);
        assertThat(SimilarityRanker.cosineSimilarity(EmbeddingVector.of(), EmbeddingVector.of()))
                .isEqualTo(0.0);
    }

    @Test
    void cosineSimilarity_nonFiniteComponents_isZero() {
        assertThat(SimilarityRanker.cosineSimilarity(EmbeddingVector.of(Double.NaN, 1), EmbeddingVector.of(1, 0)))
                .isZero();
        assertThat(SimilarityRanker.cosineSimilarity(
                EmbeddingVector.of(Double.POSITIVE_INFINITY, 0), EmbeddingVector.of(1, 0)))
                .isZero();
    }

    @Test
    void findSimilar_nonFiniteVector_rankedAsUnrelated() {
        SourceFile file = file("f1",
                fragment("broken", EmbeddingVector.of(Double.NaN, 0)),
                fragment("close", EmbeddingVector.of(1, 0.1)),
                fragment("opposite", EmbeddingVector.of(-1, 0)));

        List<RankedMatch> matches = ranker.findSimilar(EmbeddingVector.of(1, 0), List.of(file), 3);

        assertThat(matches).extracting(m -> m.fragment().id()).containsExactly("close", "broken", "opposite");
        assertThat(matches.get(1).similarity()).isZero();
    }

    @Test
    void cosineSimilarity_alwaysWithinBounds() {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            EmbeddingVector a = randomVector(random, 16);
            EmbeddingVector b = random.nextBoolean() ? a : randomVector(random, 16);

            assertThat(SimilarityRanker.cosineSimilarity(a, b)).isBetween(-1.0, 1.0);
        }
    }

    @Test
    void cosineSimilarity_ignoresMagnitude() {
        double similarity = SimilarityRanker.cosineSimilarity(EmbeddingVector.of(3, 4), EmbeddingVector.of(30, 40));

        assertThat(similarity).isCloseTo(1.0, within(1e-12));
    }

    private static EmbeddingVector randomVector(Random random, int dimensions) {
        double[] values = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            values[i] = random.nextDouble() * 2 - 1;
        }
        return EmbeddingVector.of(values);
    }

    private static Fragment fragment(String id, EmbeddingVector embedding) {
        return new Fragment(id, "content of " + id, 1, 1, FragmentKind.BLOCK, embedding);
    }

    private static SourceFile file(String id, Fragment... fragments) {
        return new SourceFile(id, "session", id + ".ts", "typescript", "content",
                List.of(fragments), List.of(), List.of(), Instant.EPOCH);
    }
}
