package com.example.chronotrace.index;

import com.example.chronotrace.embedding.EmbeddingVector;

import java.util.List;
import java.util.Optional;

/**
 * Similarity index over segment embeddings with metadata pre-filtering.
 */
public interface VectorIndex {

    /**
     * Inserts the point, replacing any point with the same id. Readers see either the old or
     * the new point, never a mix.
     *
     * @throws com.example.chronotrace.error.IndexCapacityException when a new id would exceed capacity
     */
    void upsert(IndexPoint point);

    boolean remove(String pointId);

    Optional<IndexPoint> get(String pointId);

    /**
     * Top {@code topK} points that pass every filter and score at least {@code scoreThreshold},
     * in {@link ScoredPoint#RANKING} order. Returns fewer results when fewer qualify.
     *
     * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
     */
    List<ScoredPoint> search(EmbeddingVector query, SearchFilters filters, int topK, double scoreThreshold);

    long size();

    /**
     * Drops the in-memory state and reloads every persisted point.
     */
    void rebuildFromDatabase();

    default String kind() {
        return getClass().getSimpleName();
    }
}
