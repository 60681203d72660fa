package com.bsl.dimrank.index;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Deterministic bag-of-words embedder for the local index: each token is hashed into one of
 * {@link #DIMENSION} buckets and the vector is L2-normalized. Texts sharing words end up close.
 */
@Component
public class HashingEmbedder {
    public static final int DIMENSION = 384;

    public List<Double> embed(String text) {
        double[] values = new double[DIMENSION];
        if (text != null) {
            for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
                if (token.isEmpty()) {
                    continue;
                }
                values[bucket(token)] += 1.0;
            }
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = Math.sqrt(sumSquares);
        if (norm == 0.0) {
            norm = 1.0;
        }
        List<Double> vector = new ArrayList<>(DIMENSION);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private int bucket(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            long seed = ByteBuffer.wrap(hash, 0, 8).getLong();
            return (int) Math.floorMod(seed, (long) DIMENSION);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
