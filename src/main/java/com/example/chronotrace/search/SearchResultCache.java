package com.example.chronotrace.search;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.embedding.Fingerprints;
import com.example.chronotrace.index.SearchFilters;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Ranked result lists keyed by normalized query text and the canonical filter key. Entries
 * simply expire; new ingests do not invalidate them.
 *
 * <p>An entry remembers the {@code topK} and threshold it was computed with and answers any
 * request it fully covers: a smaller or equal {@code topK} and an equal or stricter threshold.</p>
 */
@Component
public class SearchResultCache {

    private final Cache<String, Entry> cache;
    private final Duration defaultTtl;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();

    @Autowired
    public SearchResultCache(ChronoTraceProperties properties) {
        this(properties.getSearch().getResultTtl(), properties.getSearch().getMaxCachedResults(), Ticker.systemTicker());
    }

    SearchResultCache(Duration defaultTtl, long maxEntries, Ticker ticker) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry value, long currentTime) {
                        return value.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
                        return value.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public static String key(String queryText, SearchFilters filters) {
        SearchFilters f = filters == null ? SearchFilters.none() : filters;
        return Fingerprints.sha256Hex(Fingerprints.normalizeText(queryText) + "|" + f.canonicalKey());
    }

    /**
     * The full cached list for this text and filter set, as stored.
     */
    public Optional<List<SearchHit>> lookup(String queryText, SearchFilters filters) {
        Entry e = cache.getIfPresent(key(queryText, filters));
        if (e == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(e.hits);
    }

    /**
     * Cached results narrowed to {@code topK} and {@code threshold}, if the cached entry covers them.
     */
    public Optional<List<SearchHit>> lookup(String queryText, SearchFilters filters, int topK, double threshold) {
        Entry e = cache.getIfPresent(key(queryText, filters));
        if (e == null || !e.covers(topK, threshold)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(e.hits.stream()
                .filter(h -> h.getScore() >= threshold)
                .limit(topK)
                .collect(Collectors.toList()));
    }

    public void store(String queryText, SearchFilters filters, List<SearchHit> results, Duration ttl) {
        store(queryText, filters, results, Integer.MAX_VALUE, -1.0, ttl);
    }

    public void store(String queryText, SearchFilters filters, List<SearchHit> results, int topK, double threshold, Duration ttl) {
        Duration effective = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        cache.put(key(queryText, filters), new Entry(List.copyOf(results), topK, threshold, effective));
        stores.incrementAndGet();
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("entries", size());
        out.put("hits", hits.get());
        out.put("misses", misses.get());
        out.put("stores", stores.get());
        out.put("ttlSeconds", defaultTtl.getSeconds());
        return out;
    }

    private static final class Entry {
        final List<SearchHit> hits;
        final int topK;
        final double threshold;
        final Duration ttl;

        Entry(List<SearchHit> hits, int topK, double threshold, Duration ttl) {
            this.hits = hits;
            this.topK = topK;
            this.threshold = threshold;
            this.ttl = ttl;
        }

        boolean covers(int requestedTopK, double requestedThreshold) {
            if (requestedThreshold < threshold) return false;
            // a short list means every qualifying point was already returned
            return requestedTopK <= topK || hits.size() < topK;
        }
    }
}
