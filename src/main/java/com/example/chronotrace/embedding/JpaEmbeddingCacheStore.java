package com.example.chronotrace.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Component
public class JpaEmbeddingCacheStore implements EmbeddingCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JpaEmbeddingCacheStore.class);

    private final EmbeddingCacheRepository repo;

    public JpaEmbeddingCacheStore(EmbeddingCacheRepository repo) {
        this.repo = repo;
    }

    @Override
    public Optional<CachedEmbedding> load(String fingerprint, Duration ttl) {
        EmbeddingCacheRecord r = repo.findById(fingerprint).orElse(null);
        if (r == null) return Optional.empty();
        Instant createdAt = Instant.ofEpochMilli(r.getCreatedAt());
        if (createdAt.plus(ttl).isBefore(Instant.now())) {
            log.debug("Stored embedding {} expired at {}", fingerprint, createdAt.plus(ttl));
            return Optional.empty();
        }
        try {
            return Optional.of(new CachedEmbedding(VectorCodec.decode(r.getVectorBlob()), r.getChecksum(), createdAt));
        } catch (RuntimeException ex) {
            log.warn("Stored embedding {} is unreadable, recomputing: {}", fingerprint, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String fingerprint, CachedEmbedding entry) {
        EmbeddingCacheRecord r = repo.findById(fingerprint).orElseGet(EmbeddingCacheRecord::new);
        r.setFingerprint(fingerprint);
        r.setChecksum(entry.getChecksum());
        r.setVectorBlob(VectorCodec.encode(entry.getVector()));
        r.setDimension(entry.getVector().dimension());
        r.setCreatedAt(entry.getCreatedAt().toEpochMilli());
        repo.save(r);
    }
}
