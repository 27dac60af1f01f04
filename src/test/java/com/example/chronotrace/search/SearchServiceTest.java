package com.example.chronotrace.search;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.embedding.EmbeddingCache;
import com.example.chronotrace.embedding.EmbeddingPipeline;
import com.example.chronotrace.embedding.EmbeddingService;
import com.example.chronotrace.embedding.EmbeddingServiceException;
import com.example.chronotrace.embedding.EmbeddingVector;
import com.example.chronotrace.error.FilterValidationException;
import com.example.chronotrace.error.PermanentExternalException;
import com.example.chronotrace.error.SearchTimeoutException;
import com.example.chronotrace.index.BruteForceVectorIndex;
import com.example.chronotrace.index.IndexPoint;
import com.example.chronotrace.index.PointMetadata;
import com.example.chronotrace.index.SearchFilters;
import com.example.chronotrace.ingest.SegmentCatalog;
import com.example.chronotrace.ingest.SegmentRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SearchServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private ExecutorService executor;
    private ChronoTraceProperties properties;
    private TextService service;
    private BruteForceVectorIndex index;
    private SearchResultCache resultCache;
    private SegmentCatalog catalog;
    private SearchService search;

    @BeforeEach
    public void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new ChronoTraceProperties();
        properties.getEmbedding().setDimension(3);
        properties.getEmbedding().setCallTimeout(Duration.ofSeconds(5));
        properties.getEmbedding().getRetry().setMaxAttempts(1);
        properties.getSearch().setTimeout(Duration.ofMillis(300));
        properties.getSearch().setMaxTopK(20);

        service = new TextService();
        index = new BruteForceVectorIndex(100);
        resultCache = new SearchResultCache(properties);
        catalog = mock(SegmentCatalog.class);
        EmbeddingPipeline pipeline = new EmbeddingPipeline(service,
                new EmbeddingCache("segment", Duration.ofDays(7), 100, null),
                new EmbeddingCache("query", Duration.ofHours(1), 100, null),
                executor, properties);
        search = new SearchService(pipeline, index, resultCache, catalog, executor, properties);

        for (int i = 0; i < 5; i++) {
            index.upsert(point("p" + i, "seg-" + i, new float[]{1f, 0.2f * i, 0f}, "CAM-1"));
        }
        index.upsert(point("p9", "seg-9", new float[]{1f, 0f, 0f}, "CAM-2"));
    }

    @AfterEach
    public void tearDown() {
        service.release.countDown();
        executor.shutdownNow();
    }

    private static IndexPoint point(String id, String segmentId, float[] v, String camera) {
        PointMetadata m = PointMetadata.builder()
                .videoId("v-" + camera).cameraId(camera).location("dock")
                .startOffset(0).endOffset(15).timestamp(T0).build();
        return new IndexPoint(id, segmentId, EmbeddingVector.of(v), m);
    }

    private static SearchRequest request(String q, SearchFilters filters, Integer topK, Double threshold) {
        return SearchRequest.builder().query(q).filters(filters).topK(topK).scoreThreshold(threshold).build();
    }

    @Test
    public void repeatedQueryIsServedFromTheResultCache() {
        SearchFilters cam1 = SearchFilters.builder().cameraId("CAM-1").build();

        SearchResponse first = search.search(request("person in red jacket", cam1, 3, 0.0));
        SearchResponse second = search.search(request("Person in red jacket ", cam1, 3, 0.0));

        assertThat(first.isCacheHit()).isFalse();
        assertThat(second.isCacheHit()).isTrue();
        assertThat(second.getResults()).isEqualTo(first.getResults());
        assertThat(first.getResults()).hasSize(3)
                .allSatisfy(h -> assertThat(h.getCameraId()).isEqualTo("CAM-1"))
                .extracting(SearchHit::getSegmentId).containsExactly("seg-0", "seg-1", "seg-2");
        assertThat(service.calls.get()).isEqualTo(1);
    }

    @Test
    public void largerPageRunsTheSearchAgainButReusesTheQueryEmbedding() {
        search.search(request("forklift", SearchFilters.none(), 2, 0.0));
        SearchResponse wider = search.search(request("forklift", SearchFilters.none(), 6, 0.0));

        assertThat(wider.isCacheHit()).isFalse();
        assertThat(wider.getResults()).hasSize(6);
        assertThat(service.calls.get()).isEqualTo(1);
    }

    @Test
    public void hitsAreEnrichedFromTheCatalogWhenKnown() {
        SegmentRecord r = new SegmentRecord();
        r.setId("seg-0");
        r.setVideoId("catalog-video");
        r.setCameraId("CAM-1");
        r.setLocation("gate");
        r.setStartOffset(30);
        r.setEndOffset(45);
        r.setTimestamp(T0.toEpochMilli());
        r.setHasFaces(true);
        when(catalog.findAll(anyCollection())).thenReturn(Map.of("seg-0", r));

        SearchResponse resp = search.search(request("anything", SearchFilters.builder().cameraId("CAM-1").build(), 5, 0.0));

        SearchHit top = resp.getResults().get(0);
        assertThat(top.getVideoId()).isEqualTo("catalog-video");
        assertThat(top.getDuration()).isEqualTo(15.0);
        assertThat(top.isHasFaces()).isTrue();
        assertThat(resp.getResults().get(1).getVideoId()).isEqualTo("v-CAM-1");
    }

    @Test
    public void invalidRequestsAreRejectedBeforeAnyEmbeddingCall() {
        assertThatThrownBy(() -> search.search(request("  ", null, null, null)))
                .isInstanceOf(FilterValidationException.class);
        assertThatThrownBy(() -> search.search(request("q", null, 0, null)))
                .isInstanceOf(FilterValidationException.class);
        assertThatThrownBy(() -> search.search(request("q", null, 21, null)))
                .isInstanceOf(FilterValidationException.class);
        assertThatThrownBy(() -> search.search(request("q", null, 5, 1.5)))
                .isInstanceOf(FilterValidationException.class);

        assertThat(service.calls.get()).isZero();
    }

    @Test
    public void failedSearchesAreNotCached() {
        service.failWith = new EmbeddingServiceException(EmbeddingServiceException.Kind.PERMANENT, "bad input");

        assertThatThrownBy(() -> search.search(request("broken", SearchFilters.none(), 5, 0.0)))
                .isInstanceOf(PermanentExternalException.class);
        assertThat(resultCache.size()).isZero();

        service.failWith = null;
        assertThat(search.search(request("broken", SearchFilters.none(), 5, 0.0)).isCacheHit()).isFalse();
        assertThat(service.calls.get()).isEqualTo(2);
    }

    @Test
    public void slowSearchTimesOutAndIsNotCached() {
        service.block = true;

        assertThatThrownBy(() -> search.search(request("slow", SearchFilters.none(), 5, 0.0)))
                .isInstanceOf(SearchTimeoutException.class);
        assertThat(resultCache.size()).isZero();
    }

    @Test
    public void concurrentIdenticalQueriesShareOneEmbeddingCall() throws Exception {
        service.block = true;
        ExecutorService callers = Executors.newFixedThreadPool(4);
        properties.getSearch().setTimeout(Duration.ofSeconds(5));
        try {
            for (int i = 0; i < 4; i++) {
                callers.submit(() -> search.search(request("same text", SearchFilters.none(), 5, 0.0)));
            }
            Thread.sleep(100);
            service.release.countDown();
            callers.shutdown();
            assertThat(callers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            callers.shutdownNow();
        }
        assertThat(service.calls.get()).isEqualTo(1);
    }

    static final class TextService implements EmbeddingService {
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean block;
        volatile EmbeddingServiceException failWith;

        @Override
        public float[] embedVideo(byte[] content) {
            throw new UnsupportedOperationException();
        }

        @Override
        public float[] embedText(String text) {
            calls.incrementAndGet();
            if (failWith != null) throw failWith;
            if (block) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingServiceException(EmbeddingServiceException.Kind.TRANSIENT, "interrupted");
                }
            }
            return new float[]{1f, 0f, 0f};
        }

        @Override
        public int dimension() {
            return 3;
        }
    }
}
