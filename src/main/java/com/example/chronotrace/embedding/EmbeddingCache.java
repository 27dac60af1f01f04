package com.example.chronotrace.embedding;

import com.example.chronotrace.error.CacheInconsistencyException;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Content-addressed embedding cache with per-fingerprint coalescing.
 *
 * <p>The first caller for a fingerprint installs an incomplete future in the Caffeine map and
 * runs the computation on its own thread; concurrent callers for the same fingerprint join that
 * future and receive the same vector or the same error. Caffeine locks only the map bin of the
 * key, so unrelated fingerprints never wait on each other. A failed future is dropped from the
 * map, so the next caller starts over.</p>
 *
 * <p>An optional {@link EmbeddingCacheStore} is consulted before computing and written after a
 * successful computation. Entries expire {@code ttl} after they were first computed, so a row
 * loaded from the store only lives out the rest of its original lifetime in memory.</p>
 */
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    private final String name;
    private final Duration ttl;
    private final AsyncCache<String, CachedEmbedding> cache;
    private final EmbeddingCacheStore store;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong storeHits = new AtomicLong();
    private final AtomicLong computes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong inconsistencies = new AtomicLong();

    public EmbeddingCache(String name, Duration ttl, long maxEntries, EmbeddingCacheStore store) {
        this(name, ttl, maxEntries, store, Ticker.systemTicker());
    }

    EmbeddingCache(String name, Duration ttl, long maxEntries, EmbeddingCacheStore store, Ticker ticker) {
        this(name, ttl, maxEntries, store, ticker, Clock.systemUTC());
    }

    EmbeddingCache(String name, Duration ttl, long maxEntries, EmbeddingCacheStore store, Ticker ticker, Clock clock) {
        this.name = name;
        this.ttl = ttl;
        this.store = store;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new Expiry<String, CachedEmbedding>() {
                    @Override
                    public long expireAfterCreate(String key, CachedEmbedding value, long currentTime) {
                        return remainingNanos(value);
                    }

                    @Override
                    public long expireAfterUpdate(String key, CachedEmbedding value, long currentTime, long currentDuration) {
                        return remainingNanos(value);
                    }

                    @Override
                    public long expireAfterRead(String key, CachedEmbedding value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .buildAsync();
    }

    long remainingNanos(CachedEmbedding entry) {
        Duration age = Duration.between(entry.getCreatedAt(), Instant.now(clock));
        Duration left = ttl.minus(age.isNegative() ? Duration.ZERO : age);
        return left.isNegative() ? 0L : left.toNanos();
    }

    /**
     * Returns the vector cached under {@code fingerprint}, computing it with {@code computeFn} on a
     * miss. {@code computeFn} runs at most once per fingerprint at any time.
     *
     * @param checksum checksum of the content behind the fingerprint; a cached entry with a
     *                 different checksum raises {@link CacheInconsistencyException}
     */
    public EmbeddingResult getOrCompute(String fingerprint, String checksum, Supplier<EmbeddingVector> computeFn) {
        CompletableFuture<CachedEmbedding> created = new CompletableFuture<>();
        CompletableFuture<CachedEmbedding> future = cache.get(fingerprint, (k, executor) -> created);
        boolean hit = true;
        if (future == created) {
            misses.incrementAndGet();
            hit = fill(fingerprint, checksum, created, computeFn);
        } else {
            hits.incrementAndGet();
        }

        CachedEmbedding entry = await(future);
        if (checksum != null && !checksum.equals(entry.getChecksum())) {
            inconsistencies.incrementAndGet();
            log.error("{} cache: fingerprint {} collides: cached checksum {} vs requested {}",
                    name, fingerprint, entry.getChecksum(), checksum);
            throw new CacheInconsistencyException(fingerprint,
                    "fingerprint " + fingerprint + " is already bound to different content");
        }
        return new EmbeddingResult(fingerprint, entry.getVector(), hit);
    }

    // returns true when the value came from the durable store rather than computeFn
    private boolean fill(String fingerprint, String checksum, CompletableFuture<CachedEmbedding> created,
                         Supplier<EmbeddingVector> computeFn) {
        try {
            Optional<CachedEmbedding> stored = loadStored(fingerprint);
            if (stored.isPresent()) {
                storeHits.incrementAndGet();
                created.complete(stored.get());
                return true;
            }
            computes.incrementAndGet();
            EmbeddingVector vector = computeFn.get();
            CachedEmbedding entry = new CachedEmbedding(vector, checksum, Instant.now(clock));
            saveStored(fingerprint, entry);
            created.complete(entry);
            return false;
        } catch (RuntimeException | Error e) {
            failures.incrementAndGet();
            created.completeExceptionally(e);
            cache.asMap().remove(fingerprint, created);
            log.debug("{} cache: compute for {} failed: {}", name, fingerprint, e.getMessage());
            return false;
        }
    }

    private Optional<CachedEmbedding> loadStored(String fingerprint) {
        if (store == null) return Optional.empty();
        try {
            return store.load(fingerprint, ttl);
        } catch (RuntimeException ex) {
            log.warn("{} cache: durable lookup for {} failed, treating as miss: {}", name, fingerprint, ex.getMessage());
            return Optional.empty();
        }
    }

    private void saveStored(String fingerprint, CachedEmbedding entry) {
        if (store == null) return;
        try {
            store.save(fingerprint, entry);
        } catch (RuntimeException ex) {
            log.warn("{} cache: failed to persist {}: {}", name, fingerprint, ex.getMessage());
        }
    }

    private static CachedEmbedding await(CompletableFuture<CachedEmbedding> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    public Optional<EmbeddingVector> peek(String fingerprint) {
        CompletableFuture<CachedEmbedding> f = cache.getIfPresent(fingerprint);
        if (f == null || !f.isDone() || f.isCompletedExceptionally()) return Optional.empty();
        return Optional.of(f.join().getVector());
    }

    public void invalidate(String fingerprint) {
        cache.synchronous().invalidate(fingerprint);
    }

    public long size() {
        return cache.synchronous().estimatedSize();
    }

    public long computeCount() {
        return computes.get();
    }

    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("size", size());
        out.put("hits", hits.get());
        out.put("misses", misses.get());
        out.put("storeHits", storeHits.get());
        out.put("computes", computes.get());
        out.put("failures", failures.get());
        out.put("inconsistencies", inconsistencies.get());
        out.put("ttlSeconds", ttl.getSeconds());
        return out;
    }
}
