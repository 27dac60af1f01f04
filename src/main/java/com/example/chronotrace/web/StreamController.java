package com.example.chronotrace.web;

import com.example.chronotrace.tracking.Detection;
import com.example.chronotrace.tracking.SubmitResult;
import com.example.chronotrace.tracking.TrackSnapshot;
import com.example.chronotrace.tracking.TrackingService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
public class StreamController {

    private final TrackingService trackingService;

    public StreamController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @PostMapping("/streams/{streamId}/detections")
    public SubmitResult detections(@PathVariable("streamId") String streamId, @RequestBody ApiModels.DetectionsRequest req) {
        if (req.getDetections() == null) throw new IllegalArgumentException("detections are required");
        List<Detection> detections = req.getDetections().stream()
                .map(ApiModels.DetectionBody::toDetection)
                .collect(Collectors.toList());
        return trackingService.submitDetections(streamId, detections);
    }

    @PostMapping("/streams/{streamId}/objects")
    public Map<String, Object> objects(@PathVariable("streamId") String streamId, @RequestBody ApiModels.StationaryObjectBody body) {
        trackingService.registerObject(streamId, body.toObject());
        return Collections.singletonMap("registered", body.getId());
    }

    @PostMapping("/streams/{streamId}/analyze")
    public List<ApiModels.AnomalyView> analyze(@PathVariable("streamId") String streamId,
                                               @RequestBody(required = false) ApiModels.AnalyzeRequest req) {
        Instant at = req == null ? null : req.getAt();
        List<String> segmentIds = req == null ? null : req.getSegmentIds();
        return trackingService.analyze(streamId, at, segmentIds).stream()
                .map(ApiModels.AnomalyView::of)
                .collect(Collectors.toList());
    }

    @GetMapping("/streams")
    public Set<String> streams() {
        return trackingService.streamIds();
    }

    @GetMapping("/tracks")
    public List<TrackSnapshot> tracks(
            @RequestParam(name = "cameraId", required = false) String cameraId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return trackingService.tracks(cameraId, from, to);
    }
}
