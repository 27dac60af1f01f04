package com.example.chronotrace.embedding;

import java.time.Instant;

/**
 * Cache value: the vector together with the checksum of the content that produced it.
 */
public final class CachedEmbedding {

    private final EmbeddingVector vector;
    private final String checksum;
    private final Instant createdAt;

    public CachedEmbedding(EmbeddingVector vector, String checksum, Instant createdAt) {
        this.vector = vector;
        this.checksum = checksum;
        this.createdAt = createdAt;
    }

    public EmbeddingVector getVector() {
        return vector;
    }

    public String getChecksum() {
        return checksum;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
