package com.example.chronotrace.web;

import com.example.chronotrace.ingest.IngestService;
import com.example.chronotrace.ingest.IngestStatus;
import com.example.chronotrace.ingest.SegmentCatalog;
import com.example.chronotrace.ingest.SegmentRecord;
import com.example.chronotrace.ingest.VideoSummary;
import com.example.chronotrace.search.SearchResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Videos are the groups of catalogued segments sharing a video id.
 */
@RestController
@RequestMapping("/api/videos")
public class VideoController {

    private static final Logger log = LoggerFactory.getLogger(VideoController.class);

    private final SegmentCatalog catalog;
    private final IngestService ingestService;
    private final SearchResultCache searchResultCache;

    public VideoController(SegmentCatalog catalog, IngestService ingestService, SearchResultCache searchResultCache) {
        this.catalog = catalog;
        this.ingestService = ingestService;
        this.searchResultCache = searchResultCache;
    }

    @GetMapping
    public ApiModels.VideoPage list(@RequestParam(name = "page", defaultValue = "1") int page,
                                    @RequestParam(name = "pageSize", defaultValue = "20") int pageSize,
                                    @RequestParam(name = "status", required = false) IngestStatus status) {
        return ApiModels.VideoPage.of(catalog.listVideos(page, pageSize, status), page, pageSize);
    }

    @GetMapping("/{videoId}")
    public ResponseEntity<VideoSummary> get(@PathVariable("videoId") String videoId) {
        return catalog.video(videoId).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{videoId}/segments")
    public ResponseEntity<List<SegmentRecord>> segments(@PathVariable("videoId") String videoId) {
        List<SegmentRecord> segments = catalog.forVideo(videoId);
        return segments.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(segments);
    }

    @DeleteMapping("/{videoId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable("videoId") String videoId) {
        int removed = ingestService.deleteVideo(videoId);
        if (removed == 0) {
            return ResponseEntity.notFound().build();
        }
        // cached result lists may name the removed segments
        searchResultCache.clear();
        log.info("Deleted video {} ({} segments), search result cache cleared", videoId, removed);
        return ResponseEntity.ok(Map.of("videoId", videoId, "deletedSegments", removed));
    }
}
