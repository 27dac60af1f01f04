package com.example.chronotrace.index;

import com.example.chronotrace.embedding.EmbeddingVector;
import com.example.chronotrace.error.IndexCapacityException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.chronotrace.index.IndexFixtures.T0;
import static com.example.chronotrace.index.IndexFixtures.point;
import static com.example.chronotrace.index.IndexFixtures.randomVector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HnswVectorIndexTest {

    private static final int DIM = 16;

    private static void fill(VectorIndex a, VectorIndex b, int n, long seed) {
        Random rnd = new Random(seed);
        for (int i = 0; i < n; i++) {
            IndexPoint p = point("p" + i, randomVector(rnd, DIM), "CAM-" + (i % 5), T0.plusSeconds(i), i % 2 == 0, false);
            a.upsert(p);
            b.upsert(p);
        }
    }

    private static double recall(List<ScoredPoint> approx, List<ScoredPoint> exact) {
        if (exact.isEmpty()) return 1.0;
        Set<String> truth = exact.stream().map(ScoredPoint::getPointId).collect(Collectors.toSet());
        Set<String> got = new HashSet<>();
        approx.forEach(p -> got.add(p.getPointId()));
        got.retainAll(truth);
        return (double) got.size() / truth.size();
    }

    @Test
    public void graphSearchRecallIsCloseToExact() {
        HnswVectorIndex hnsw = new HnswVectorIndex(16, 200, 100, 5000, 0);
        BruteForceVectorIndex exact = new BruteForceVectorIndex(5000);
        fill(hnsw, exact, 1500, 42);

        Random rnd = new Random(99);
        double total = 0;
        int queries = 30;
        for (int i = 0; i < queries; i++) {
            EmbeddingVector q = EmbeddingVector.of(randomVector(rnd, DIM));
            total += recall(hnsw.search(q, SearchFilters.none(), 10, -1.0),
                    exact.search(q, SearchFilters.none(), 10, -1.0));
        }
        assertThat(total / queries).isGreaterThanOrEqualTo(0.9);
    }

    @Test
    public void filteredGraphSearchOnlyReturnsMatchingPoints() {
        HnswVectorIndex hnsw = new HnswVectorIndex(16, 200, 100, 5000, 0);
        BruteForceVectorIndex exact = new BruteForceVectorIndex(5000);
        fill(hnsw, exact, 1000, 5);
        SearchFilters filters = SearchFilters.builder().cameraId("CAM-3").hasFaces(true).build();

        Random rnd = new Random(3);
        double total = 0;
        for (int i = 0; i < 20; i++) {
            EmbeddingVector q = EmbeddingVector.of(randomVector(rnd, DIM));
            List<ScoredPoint> hits = hnsw.search(q, filters, 10, -1.0);
            assertThat(hits).hasSize(10);
            assertThat(hits).allSatisfy(h -> {
                assertThat(h.getMetadata().getCameraId()).isEqualTo("CAM-3");
                assertThat(h.getMetadata().isHasFaces()).isTrue();
            });
            assertThat(hits).isSortedAccordingTo(ScoredPoint.RANKING);
            total += recall(hits, exact.search(q, filters, 10, -1.0));
        }
        assertThat(total / 20).isGreaterThanOrEqualTo(0.8);
    }

    @Test
    public void smallCandidateSetsAreRankedExactly() {
        HnswVectorIndex hnsw = new HnswVectorIndex(16, 200, 100, 5000, 1000);
        BruteForceVectorIndex exact = new BruteForceVectorIndex(5000);
        fill(hnsw, exact, 500, 11);
        EmbeddingVector q = EmbeddingVector.of(randomVector(new Random(1), DIM));
        SearchFilters filters = SearchFilters.builder().cameraId("CAM-1").build();

        assertThat(hnsw.search(q, filters, 7, 0.1)).extracting(ScoredPoint::getPointId)
                .containsExactlyElementsOf(exact.search(q, filters, 7, 0.1).stream()
                        .map(ScoredPoint::getPointId).collect(Collectors.toList()));
    }

    @Test
    public void thresholdStopsTheGraphWalk() {
        HnswVectorIndex hnsw = new HnswVectorIndex(16, 200, 100, 5000, 0);
        BruteForceVectorIndex exact = new BruteForceVectorIndex(5000);
        fill(hnsw, exact, 800, 8);
        EmbeddingVector q = EmbeddingVector.of(randomVector(new Random(12), DIM));

        List<ScoredPoint> hits = hnsw.search(q, SearchFilters.none(), 100, 0.5);

        assertThat(hits).allSatisfy(h -> assertThat(h.getScore()).isGreaterThanOrEqualTo(0.5));
        assertThat(hits.size()).isLessThanOrEqualTo(exact.search(q, SearchFilters.none(), 100, 0.5).size());
    }

    @Test
    public void upsertReplacesAndRemoveDeletes() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 50, 50, 100, 0);
        hnsw.upsert(point("a", new float[]{1f, 0f, 0f}, "CAM-1", T0));
        hnsw.upsert(point("b", new float[]{0f, 1f, 0f}, "CAM-1", T0));
        hnsw.upsert(point("a", new float[]{0f, 0f, 1f}, "CAM-2", T0));
        EmbeddingVector q = EmbeddingVector.of(new float[]{0f, 0f, 1f});

        List<ScoredPoint> hits = hnsw.search(q, SearchFilters.none(), 5, -1.0);
        assertThat(hnsw.size()).isEqualTo(2);
        assertThat(hits.get(0).getPointId()).isEqualTo("a");
        assertThat(hits.get(0).getMetadata().getCameraId()).isEqualTo("CAM-2");

        assertThat(hnsw.remove("a")).isTrue();
        assertThat(hnsw.remove("a")).isFalse();
        assertThat(hnsw.search(q, SearchFilters.none(), 5, -1.0))
                .extracting(ScoredPoint::getPointId).containsExactly("b");
    }

    @Test
    public void repeatedReplacementDoesNotExhaustTheGraph() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 50, 50, 10, 0);
        Random rnd = new Random(4);
        for (int round = 0; round < 50; round++) {
            for (int i = 0; i < 10; i++) {
                hnsw.upsert(point("p" + i, randomVector(rnd, DIM), "CAM-1", T0));
            }
        }
        assertThat(hnsw.size()).isEqualTo(10);
        assertThat(hnsw.search(EmbeddingVector.of(randomVector(rnd, DIM)), SearchFilters.none(), 10, -1.0)).hasSize(10);
    }

    @Test
    public void rejectsNewPointsOnceFullAndMismatchedDimensions() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 50, 50, 2, 0);
        hnsw.upsert(point("a", new float[]{1f, 0f, 0f}, "C", T0));
        hnsw.upsert(point("b", new float[]{0f, 1f, 0f}, "C", T0));

        assertThatThrownBy(() -> hnsw.upsert(point("c", new float[]{0f, 0f, 1f}, "C", T0)))
                .isInstanceOf(IndexCapacityException.class);
        assertThatThrownBy(() -> hnsw.upsert(point("a", new float[]{1f, 0f}, "C", T0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(hnsw.getDimensions()).isEqualTo(3);
        assertThat(hnsw.getHnswParams()).containsEntry("maxItems", 2);
    }

    @Test
    public void emptyIndexReturnsNothing() {
        HnswVectorIndex hnsw = new HnswVectorIndex(8, 50, 50, 10, 0);
        assertThat(hnsw.search(EmbeddingVector.of(new float[]{1f}), SearchFilters.none(), 5, -1.0)).isEmpty();
    }
}
