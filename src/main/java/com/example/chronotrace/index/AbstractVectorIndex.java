package com.example.chronotrace.index;

import com.example.chronotrace.embedding.EmbeddingVector;
import com.example.chronotrace.error.IndexCapacityException;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;

/**
 * Shared exact ranking, capacity check and rebuild logic.
 */
abstract class AbstractVectorIndex implements VectorIndex {

    private static final int INTERRUPT_CHECK_INTERVAL = 256;

    protected final int maxItems;

    @Autowired(required = false)
    private IndexPointStore pointStore; // used for full rebuild

    protected AbstractVectorIndex(int maxItems) {
        this.maxItems = maxItems;
    }

    void setPointStore(IndexPointStore pointStore) {
        this.pointStore = pointStore;
    }

    protected void checkCapacity(String pointId, boolean exists, long currentSize) {
        if (!exists && currentSize >= maxItems) {
            throw new IndexCapacityException(pointId, "index is full (" + currentSize + "/" + maxItems + " points)");
        }
    }

    /**
     * Exact top-K over {@code points}: filter first, then score, keep the best K in a bounded heap.
     */
    static List<ScoredPoint> rankExact(Collection<IndexPoint> points, EmbeddingVector query, SearchFilters filters,
                                       int topK, double scoreThreshold) {
        if (topK <= 0) return Collections.emptyList();
        // heap head is the currently worst kept hit
        PriorityQueue<ScoredPoint> pq = new PriorityQueue<>(topK + 1, ScoredPoint.RANKING.reversed());
        int seen = 0;
        for (IndexPoint p : points) {
            if (++seen % INTERRUPT_CHECK_INTERVAL == 0) checkInterrupted();
            if (!filters.matches(p.getMetadata())) continue;
            double score = query.cosine(p.getVector());
            if (score < scoreThreshold) continue;
            pq.offer(new ScoredPoint(p.getId(), p.getSegmentId(), score, p.getMetadata()));
            if (pq.size() > topK) pq.poll();
        }
        List<ScoredPoint> out = new ArrayList<>(pq);
        out.sort(ScoredPoint.RANKING);
        return out;
    }

    static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("search cancelled");
        }
    }

    @Override
    public void rebuildFromDatabase() {
        if (pointStore == null) {
            throw new IllegalStateException("IndexPointStore not available for rebuild");
        }
        replaceAll(pointStore.loadAll());
    }

    /**
     * Atomically swaps the whole content of the index.
     */
    protected abstract void replaceAll(List<IndexPoint> points);
}
