package com.example.chronotrace.embedding;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable second level behind the in-memory embedding cache.
 */
public interface EmbeddingCacheStore {

    /**
     * The stored entry, if present and not older than {@code ttl}.
     */
    Optional<CachedEmbedding> load(String fingerprint, Duration ttl);

    /**
     * Writes or refreshes the single row for {@code fingerprint}.
     */
    void save(String fingerprint, CachedEmbedding entry);
}
