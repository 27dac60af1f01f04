package com.example.chronotrace.embedding;

import com.example.chronotrace.config.ChronoTraceProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Deterministic stand-in for the external model: hashes tokens (text) or 4 KiB blocks (video)
 * into buckets. Every component carries a small positive bias, so any two vectors have a
 * positive cosine.
 */
@Service
@ConditionalOnProperty(name = "chronotrace.embedding.type", havingValue = "local", matchIfMissing = true)
public class LocalEmbeddingService implements EmbeddingService {

    private static final int BLOCK = 4096;
    private static final float BIAS = 0.05f;

    private final int dim;

    @Autowired
    public LocalEmbeddingService(ChronoTraceProperties properties) {
        this(properties.getEmbedding().getDimension());
    }

    public LocalEmbeddingService(int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
        this.dim = dimension;
    }

    @Override
    public float[] embedVideo(byte[] content) {
        if (content == null || content.length == 0) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "empty segment content");
        }
        float[] v = new float[dim];
        Arrays.fill(v, BIAS);
        for (int off = 0; off < content.length; off += BLOCK) {
            int len = Math.min(BLOCK, content.length - off);
            int h = Arrays.hashCode(Arrays.copyOfRange(content, off, off + len));
            v[Math.floorMod(h, dim)] += 1.0f;
        }
        return EmbeddingVector.of(v).normalized().toArray();
    }

    @Override
    public float[] embedText(String text) {
        String normalized = Fingerprints.normalizeText(text);
        if (normalized.isEmpty()) {
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "empty query text");
        }
        float[] v = new float[dim];
        Arrays.fill(v, BIAS);
        for (String token : normalized.split(" ")) {
            int h = Arrays.hashCode(token.getBytes(StandardCharsets.UTF_8));
            v[Math.floorMod(h, dim)] += 1.0f;
        }
        return EmbeddingVector.of(v).normalized().toArray();
    }

    @Override
    public int dimension() {
        return dim;
    }
}
