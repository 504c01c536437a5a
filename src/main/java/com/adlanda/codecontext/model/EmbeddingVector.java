package com.adlanda.codecontext.model;

import java.util.List;

/**
 * Fixed-length vector representation of a piece of text.
 *
 * Two vectors are only comparable when their dimensions match.
 *
 * @param values The vector components
 */
public record EmbeddingVector(List<Double> values) {

    public EmbeddingVector {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static EmbeddingVector of(double... values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new EmbeddingVector(List.of(boxed));
    }

    public static EmbeddingVector of(float[] values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = (double) values[i];
        }
        return new EmbeddingVector(List.of(boxed));
    }

    public int dimension() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
