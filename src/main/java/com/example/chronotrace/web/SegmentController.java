package com.example.chronotrace.web;

import com.example.chronotrace.ingest.IngestResult;
import com.example.chronotrace.ingest.IngestService;
import com.example.chronotrace.ingest.IngestStatus;
import com.example.chronotrace.ingest.SegmentCatalog;
import com.example.chronotrace.ingest.SegmentContent;
import com.example.chronotrace.ingest.SegmentFiles;
import com.example.chronotrace.ingest.SegmentRecord;
import com.example.chronotrace.search.SearchResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/segments")
public class SegmentController {

    private static final Logger log = LoggerFactory.getLogger(SegmentController.class);

    private final IngestService ingestService;
    private final SegmentCatalog catalog;
    private final SegmentFiles files;
    private final SearchResultCache searchResultCache;

    public SegmentController(IngestService ingestService, SegmentCatalog catalog, SegmentFiles files,
                             SearchResultCache searchResultCache) {
        this.ingestService = ingestService;
        this.catalog = catalog;
        this.files = files;
        this.searchResultCache = searchResultCache;
    }

    @PostMapping
    public ResponseEntity<IngestResult> index(@RequestBody ApiModels.SegmentRequest req) {
        log.info("Indexing segment {} of video {}", req.getId(), req.getVideoId());
        IngestResult result = ingestService.index(toContent(req));
        HttpStatus status = result.getStatus() == IngestStatus.QUEUED_FOR_RETRY ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/batch")
    public List<IngestResult> indexBatch(@RequestBody ApiModels.SegmentBatchRequest req) {
        if (req.getSegments() == null || req.getSegments().isEmpty()) {
            throw new IllegalArgumentException("segments must not be empty");
        }
        List<SegmentContent> contents = new ArrayList<>(req.getSegments().size());
        for (ApiModels.SegmentRequest s : req.getSegments()) {
            contents.add(toContent(s));
        }
        log.info("Indexing batch of {} segments", contents.size());
        return ingestService.indexAll(contents);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SegmentRecord> get(@PathVariable("id") String id) {
        return catalog.find(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable("id") String id) {
        if (!ingestService.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        searchResultCache.clear();
        log.info("Deleted segment {}, search result cache cleared", id);
        return ResponseEntity.ok(Map.of("segmentId", id, "deleted", true));
    }

    private SegmentContent toContent(ApiModels.SegmentRequest req) {
        byte[] bytes;
        if (req.getContentBase64() != null) {
            bytes = Base64.getDecoder().decode(req.getContentBase64());
        } else if (req.getContentPath() != null) {
            bytes = files.read(req.getContentPath());
        } else {
            throw new IllegalArgumentException("contentBase64 or contentPath is required for segment " + req.getId());
        }
        return new SegmentContent(req.toSegment(), bytes);
    }
}
