package com.adlanda.codecontext.embedding;

import com.adlanda.codecontext.model.EmbeddingVector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

/**
 * Deterministic embedding provider seeded from a hash of the text. It lets the
 * service run locally and in tests without calling an external API; identical
 * text always yields the identical unit vector.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private final int dimensions;

    public DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public EmbeddingVector embed(String text) {
        Random random = new Random(bytesToLong(sha256(text == null ? "" : text)));
        double[] vector = new double[dimensions];
        double norm = 0.0d;
        for (int i = 0; i < vector.length; i++) {
            double value = (random.nextDouble() * 2.0d) - 1.0d;
            vector[i] = value;
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = vector[i] / norm;
            }
        }
        return EmbeddingVector.of(vector);
    }

    private byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private long bytesToLong(byte[] bytes) {
        long result = 0L;
        for (int i = 0; i < Math.min(8, bytes.length); i++) {
            result = (result << 8) | (bytes[i] & 0xFF);
        }
        return result;
    }
}
