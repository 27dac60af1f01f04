package com.example.chronotrace.embedding;

/**
 * Outcome of one pipeline call.
 */
public final class EmbeddingResult {

    private final String fingerprint;
    private final EmbeddingVector vector;
    private final boolean cacheHit;

    public EmbeddingResult(String fingerprint, EmbeddingVector vector, boolean cacheHit) {
        this.fingerprint = fingerprint;
        this.vector = vector;
        this.cacheHit = cacheHit;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public EmbeddingVector getVector() {
        return vector;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }
}
