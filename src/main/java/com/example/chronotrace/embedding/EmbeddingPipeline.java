package com.example.chronotrace.embedding;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.error.PermanentExternalException;
import com.example.chronotrace.error.TransientExternalException;
import com.example.chronotrace.ingest.SegmentContent;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * fingerprint, cache lookup, external call on miss, store, hand the vector downstream.
 *
 * <p>External calls are limited to {@code embedding.concurrency} at a time, each bounded by
 * {@code embedding.call-timeout}. Transient failures are retried with exponential backoff;
 * permanent ones are surfaced at once.</p>
 */
@Service
public class EmbeddingPipeline {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingPipeline.class);

    private final EmbeddingService embeddingService;
    private final EmbeddingCache segmentCache;
    private final EmbeddingCache queryCache;
    private final ExecutorService callExecutor;
    private final Semaphore permits;
    private final Duration callTimeout;
    private final int expectedDimension;
    private final int maxAttempts;
    private final Retry retry;

    @Autowired
    public EmbeddingPipeline(EmbeddingService embeddingService,
                             @Qualifier("segmentEmbeddingCache") EmbeddingCache segmentCache,
                             @Qualifier("queryEmbeddingCache") EmbeddingCache queryCache,
                             @Qualifier("embeddingCallExecutor") ExecutorService callExecutor,
                             ChronoTraceProperties properties) {
        ChronoTraceProperties.EmbeddingConfig cfg = properties.getEmbedding();
        this.embeddingService = embeddingService;
        this.segmentCache = segmentCache;
        this.queryCache = queryCache;
        this.callExecutor = callExecutor;
        this.permits = new Semaphore(Math.max(1, cfg.getConcurrency()), true);
        this.callTimeout = cfg.getCallTimeout();
        this.expectedDimension = cfg.getDimension();
        this.maxAttempts = Math.max(1, cfg.getRetry().getMaxAttempts());
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        cfg.getRetry().getInitialBackoff().toMillis(), cfg.getRetry().getMultiplier()))
                .retryOnException(EmbeddingPipeline::isTransient)
                .build();
        this.retry = Retry.of("embedding-service", retryConfig);
        this.retry.getEventPublisher().onRetry(e -> log.warn("Embedding call attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                e.getLastThrowable() == null ? "" : e.getLastThrowable().getMessage()));
    }

    public EmbeddingResult embedSegment(SegmentContent content) {
        byte[] bytes = content.getContent();
        String segmentId = content.getSegment().getId();
        String fingerprint = Fingerprints.segment(bytes);
        String checksum = Fingerprints.contentChecksum(bytes);
        EmbeddingResult result = segmentCache.getOrCompute(fingerprint, checksum,
                () -> callWithRetry(segmentId, () -> embeddingService.embedVideo(bytes)));
        log.debug("Segment {} embedded (fingerprint={}, cacheHit={})", segmentId, fingerprint, result.isCacheHit());
        return result;
    }

    public EmbeddingResult embedQuery(String queryId, String text) {
        String normalized = Fingerprints.normalizeText(text);
        if (normalized.isEmpty()) {
            throw new PermanentExternalException(queryId, "query text is empty");
        }
        String fingerprint = Fingerprints.query(normalized);
        return queryCache.getOrCompute(fingerprint, Fingerprints.textChecksum(normalized),
                () -> callWithRetry(queryId, () -> embeddingService.embedText(normalized)));
    }

    EmbeddingVector callWithRetry(String subjectId, Supplier<float[]> call) {
        Supplier<float[]> decorated = Retry.decorateSupplier(retry, () -> callOnce(call));
        float[] raw;
        try {
            raw = decorated.get();
        } catch (EmbeddingServiceException e) {
            if (e.isTransient()) {
                log.warn("Embedding for {} failed after {} attempts: {}", subjectId, maxAttempts, e.getMessage());
                throw new TransientExternalException(subjectId,
                        "embedding service unavailable after " + maxAttempts + " attempts: " + e.getMessage(), e);
            }
            log.error("Embedding for {} rejected: {}", subjectId, e.getMessage());
            throw new PermanentExternalException(subjectId, "embedding service rejected input: " + e.getMessage(), e);
        }
        if (raw == null || raw.length == 0) {
            throw new PermanentExternalException(subjectId, "embedding service returned an empty vector");
        }
        if (expectedDimension > 0 && raw.length != expectedDimension) {
            throw new PermanentExternalException(subjectId,
                    "embedding dimension " + raw.length + " does not match configured " + expectedDimension);
        }
        return EmbeddingVector.of(raw);
    }

    private float[] callOnce(Supplier<float[]> call) {
        try {
            permits.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "interrupted while waiting for a call slot", ie);
        }
        Future<float[]> f = null;
        try {
            f = callExecutor.submit(call::get);
            return f.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.TRANSIENT,
                    "embedding call timed out after " + callTimeout.toMillis() + " ms", te);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof EmbeddingServiceException) throw (EmbeddingServiceException) cause;
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT,
                    "embedding adapter failed: " + cause, cause);
        } catch (InterruptedException ie) {
            if (f != null) f.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "interrupted while embedding", ie);
        } finally {
            permits.release();
        }
    }

    private static boolean isTransient(Throwable t) {
        return t instanceof EmbeddingServiceException && ((EmbeddingServiceException) t).isTransient();
    }

    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("segmentCache", segmentCache.stats());
        out.put("queryCache", queryCache.stats());
        out.put("availableCallSlots", permits.availablePermits());
        out.put("retriedCalls", retry.getMetrics().getNumberOfSuccessfulCallsWithRetryAttempt()
                + retry.getMetrics().getNumberOfFailedCallsWithRetryAttempt());
        return out;
    }
}
