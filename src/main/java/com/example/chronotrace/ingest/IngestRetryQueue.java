package com.example.chronotrace.ingest;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.error.IndexCapacityException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Segments that could not be indexed because the index was full. Keyed by segment id so a
 * segment is queued at most once; the latest content wins.
 */
@Component
public class IngestRetryQueue {

    private final Map<String, SegmentContent> pending = new LinkedHashMap<>();
    private final int maxQueued;

    @Autowired
    public IngestRetryQueue(ChronoTraceProperties properties) {
        this.maxQueued = Math.max(1, properties.getIngest().getMaxQueuedRetries());
    }

    IngestRetryQueue(int maxQueued) {
        this.maxQueued = maxQueued;
    }

    public synchronized void enqueue(SegmentContent content) {
        String id = content.getSegment().getId();
        if (!pending.containsKey(id) && pending.size() >= maxQueued) {
            throw new IndexCapacityException(id, "index is full and the retry queue holds " + maxQueued + " segments");
        }
        pending.put(id, content);
    }

    /**
     * Removes and returns everything queued so far.
     */
    public synchronized List<SegmentContent> drain() {
        List<SegmentContent> out = new ArrayList<>(pending.values());
        pending.clear();
        return out;
    }

    public synchronized boolean remove(String segmentId) {
        return pending.remove(segmentId) != null;
    }

    public synchronized boolean contains(String segmentId) {
        return pending.containsKey(segmentId);
    }

    public synchronized int size() {
        return pending.size();
    }
}
