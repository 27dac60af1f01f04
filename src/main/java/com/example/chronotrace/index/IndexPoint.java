package com.example.chronotrace.index;

import com.example.chronotrace.embedding.EmbeddingVector;

import java.util.Objects;

/**
 * A vector plus filterable metadata. The id is distinct from the segment id so a segment can be
 * re-indexed under a new point.
 */
public final class IndexPoint {

    private final String id;
    private final String segmentId;
    private final EmbeddingVector vector;
    private final PointMetadata metadata;

    public IndexPoint(String id, String segmentId, EmbeddingVector vector, PointMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.segmentId = Objects.requireNonNull(segmentId, "segmentId");
        this.vector = Objects.requireNonNull(vector, "vector");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public String getId() {
        return id;
    }

    public String getSegmentId() {
        return segmentId;
    }

    public EmbeddingVector getVector() {
        return vector;
    }

    public PointMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "IndexPoint{id=" + id + ", segmentId=" + segmentId + ", camera=" + metadata.getCameraId() + "}";
    }
}
