package com.example.chronotrace.index;

import java.util.Comparator;

/**
 * One search hit.
 */
public final class ScoredPoint {

    /**
     * Descending score, then earliest segment timestamp, then point id.
     */
    public static final Comparator<ScoredPoint> RANKING = Comparator
            .comparingDouble(ScoredPoint::getScore).reversed()
            .thenComparing(p -> p.getMetadata().getTimestamp(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ScoredPoint::getPointId);

    private final String pointId;
    private final String segmentId;
    private final double score;
    private final PointMetadata metadata;

    public ScoredPoint(String pointId, String segmentId, double score, PointMetadata metadata) {
        this.pointId = pointId;
        this.segmentId = segmentId;
        this.score = score;
        this.metadata = metadata;
    }

    public String getPointId() {
        return pointId;
    }

    public String getSegmentId() {
        return segmentId;
    }

    public double getScore() {
        return score;
    }

    public PointMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ScoredPoint{" + segmentId + "=" + score + "}";
    }
}
