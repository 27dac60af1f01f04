package com.example.chronotrace.web;

import com.example.chronotrace.embedding.EmbeddingPipeline;
import com.example.chronotrace.index.HnswVectorIndex;
import com.example.chronotrace.index.VectorIndex;
import com.example.chronotrace.ingest.IngestRetryQueue;
import com.example.chronotrace.search.SearchResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ObjectProvider<VectorIndex> indexProvider;
    private final EmbeddingPipeline pipeline;
    private final SearchResultCache resultCache;
    private final IngestRetryQueue retryQueue;

    public AdminController(ObjectProvider<VectorIndex> indexProvider, EmbeddingPipeline pipeline,
                           SearchResultCache resultCache, IngestRetryQueue retryQueue) {
        this.indexProvider = indexProvider;
        this.pipeline = pipeline;
        this.resultCache = resultCache;
        this.retryQueue = retryQueue;
    }

    @GetMapping("/index/status")
    public Map<String, Object> indexStatus() {
        VectorIndex index = indexProvider.getIfAvailable();
        if (index == null) return Collections.singletonMap("message", "no vector index configured");
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", index.kind());
        out.put("size", index.size());
        out.put("queuedForRetry", retryQueue.size());
        if (index instanceof HnswVectorIndex) {
            HnswVectorIndex h = (HnswVectorIndex) index;
            out.put("dimensions", h.getDimensions());
            out.put("params", h.getHnswParams());
        }
        return out;
    }

    @PostMapping("/index/rebuild")
    public Map<String, Object> rebuild() {
        VectorIndex index = indexProvider.getIfAvailable();
        if (index == null) return Collections.singletonMap("message", "no vector index configured");
        long started = System.currentTimeMillis();
        index.rebuildFromDatabase();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("message", "rebuild finished");
        out.put("size", index.size());
        out.put("tookMs", System.currentTimeMillis() - started);
        log.info("Index rebuilt on request: {} points in {} ms", out.get("size"), out.get("tookMs"));
        return out;
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> cacheStats() {
        Map<String, Object> out = new LinkedHashMap<>(pipeline.stats());
        out.put("searchResults", resultCache.stats());
        return out;
    }

    @PostMapping("/cache/search/clear")
    public Map<String, Object> clearSearchCache() {
        resultCache.clear();
        return Collections.singletonMap("message", "search result cache cleared");
    }
}
