package com.example.chronotrace.anomaly;

import com.example.chronotrace.ingest.Segment;
import com.example.chronotrace.tracking.StationaryObject;
import com.example.chronotrace.tracking.TrackSnapshot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a detector may look at in one evaluation round.
 */
@Value
@Builder
public class AnalysisInput {
    String streamId;
    @Singular
    List<TrackSnapshot> tracks;
    @Singular
    List<Segment> segments;
    @Singular
    List<StationaryObject> stationaryObjects;
    @Singular
    Map<String, DwellBaseline> dwellBaselines;
    @Singular
    Map<String, MovementBaseline> movementBaselines;
    Instant evaluatedAt;
}
