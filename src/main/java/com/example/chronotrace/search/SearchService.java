package com.example.chronotrace.search;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.embedding.EmbeddingPipeline;
import com.example.chronotrace.embedding.EmbeddingResult;
import com.example.chronotrace.error.ChronoTraceException;
import com.example.chronotrace.error.FilterValidationException;
import com.example.chronotrace.error.SearchTimeoutException;
import com.example.chronotrace.index.PointMetadata;
import com.example.chronotrace.index.ScoredPoint;
import com.example.chronotrace.index.SearchFilters;
import com.example.chronotrace.index.VectorIndex;
import com.example.chronotrace.ingest.SegmentCatalog;
import com.example.chronotrace.ingest.SegmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Read path: validate, result cache, query embedding, filtered index search, catalog enrichment.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final EmbeddingPipeline pipeline;
    private final VectorIndex index;
    private final SearchResultCache resultCache;
    private final SegmentCatalog catalog;
    private final ExecutorService searchExecutor;
    private final ChronoTraceProperties.SearchConfig config;

    public SearchService(EmbeddingPipeline pipeline, VectorIndex index, SearchResultCache resultCache,
                         SegmentCatalog catalog, @Qualifier("searchExecutor") ExecutorService searchExecutor,
                         ChronoTraceProperties properties) {
        this.pipeline = pipeline;
        this.index = index;
        this.resultCache = resultCache;
        this.catalog = catalog;
        this.searchExecutor = searchExecutor;
        this.config = properties.getSearch();
    }

    public SearchResponse search(SearchRequest request) {
        long started = System.nanoTime();
        String text = validateText(request.getQuery());
        int topK = resolveTopK(request.getTopK());
        double threshold = resolveThreshold(request.getScoreThreshold());
        SearchFilters filters = request.getFilters() == null ? SearchFilters.none() : request.getFilters();
        String queryId = UUID.randomUUID().toString();

        Optional<List<SearchHit>> cached = resultCache.lookup(text, filters, topK, threshold);
        if (cached.isPresent()) {
            long ms = elapsedMillis(started);
            log.debug("Search {} served from result cache in {} ms ({} hits)", queryId, ms, cached.get().size());
            return response(queryId, text, true, ms, cached.get());
        }

        // The embedding runs on its own task so cancelling this search leaves coalesced callers untouched.
        CompletableFuture<EmbeddingResult> embedding =
                CompletableFuture.supplyAsync(() -> pipeline.embedQuery(queryId, text), searchExecutor);
        Future<List<SearchHit>> work = searchExecutor.submit(() -> {
            EmbeddingResult q = awaitEmbedding(embedding);
            List<ScoredPoint> points = index.search(q.getVector(), filters, topK, threshold);
            return enrich(points);
        });

        List<SearchHit> hits = awaitWithDeadline(queryId, work, config.getTimeout());
        resultCache.store(text, filters, hits, topK, threshold, config.getResultTtl());
        long ms = elapsedMillis(started);
        log.debug("Search {} answered in {} ms ({} hits, filters={})", queryId, ms, hits.size(), filters.canonicalKey());
        return response(queryId, text, false, ms, hits);
    }

    private List<SearchHit> awaitWithDeadline(String queryId, Future<List<SearchHit>> work, Duration timeout) {
        try {
            return work.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            work.cancel(true);
            log.warn("Search {} cancelled after {} ms", queryId, timeout.toMillis());
            throw new SearchTimeoutException(queryId, "search exceeded " + timeout.toMillis() + " ms");
        } catch (InterruptedException ie) {
            work.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("search " + queryId + " interrupted");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("search " + queryId + " failed", cause);
        }
    }

    private static EmbeddingResult awaitEmbedding(CompletableFuture<EmbeddingResult> embedding) {
        try {
            return embedding.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("search cancelled while waiting for the query embedding");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) cause = cause.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("query embedding failed", cause);
        }
    }

    private List<SearchHit> enrich(List<ScoredPoint> points) {
        if (points.isEmpty()) return List.of();
        Map<String, SegmentRecord> records = catalog.findAll(
                points.stream().map(ScoredPoint::getSegmentId).collect(Collectors.toSet()));
        List<SearchHit> out = new ArrayList<>(points.size());
        for (ScoredPoint p : points) {
            SegmentRecord r = records.get(p.getSegmentId());
            out.add(r != null ? fromCatalog(p, r) : fromMetadata(p));
        }
        return out;
    }

    private static SearchHit fromCatalog(ScoredPoint p, SegmentRecord r) {
        return SearchHit.builder()
                .segmentId(p.getSegmentId())
                .pointId(p.getPointId())
                .score(p.getScore())
                .videoId(r.getVideoId())
                .startOffset(r.getStartOffset())
                .endOffset(r.getEndOffset())
                .cameraId(r.getCameraId())
                .location(r.getLocation())
                .timestamp(Instant.ofEpochMilli(r.getTimestamp()))
                .hasFaces(r.isHasFaces())
                .hasVehicles(r.isHasVehicles())
                .motionDetected(r.isMotionDetected())
                .build();
    }

    private static SearchHit fromMetadata(ScoredPoint p) {
        PointMetadata m = p.getMetadata();
        return SearchHit.builder()
                .segmentId(p.getSegmentId())
                .pointId(p.getPointId())
                .score(p.getScore())
                .videoId(m.getVideoId())
                .startOffset(m.getStartOffset())
                .endOffset(m.getEndOffset())
                .cameraId(m.getCameraId())
                .location(m.getLocation())
                .timestamp(m.getTimestamp())
                .hasFaces(m.isHasFaces())
                .hasVehicles(m.isHasVehicles())
                .motionDetected(m.isMotionDetected())
                .build();
    }

    private static String validateText(String query) {
        if (query == null || query.isBlank()) {
            throw new FilterValidationException("query text is required");
        }
        return query;
    }

    private int resolveTopK(Integer topK) {
        int k = topK == null ? config.getDefaultTopK() : topK;
        if (k < 1 || k > config.getMaxTopK()) {
            throw new FilterValidationException("topK must be between 1 and " + config.getMaxTopK() + ", got " + k);
        }
        return k;
    }

    private static double resolveThreshold(Double threshold) {
        double t = threshold == null ? 0.0 : threshold;
        if (Double.isNaN(t) || t < -1.0 || t > 1.0) {
            throw new FilterValidationException("scoreThreshold must be within [-1, 1], got " + t);
        }
        return t;
    }

    private static SearchResponse response(String queryId, String text, boolean hit, long ms, List<SearchHit> hits) {
        return SearchResponse.builder()
                .queryId(queryId)
                .query(text)
                .cacheHit(hit)
                .latencyMs(ms)
                .results(hits)
                .build();
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
