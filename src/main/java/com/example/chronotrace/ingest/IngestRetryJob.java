package com.example.chronotrace.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-offers segments that were rejected for capacity. Anything still rejected is queued again
 * by {@link IngestService#index}.
 */
@Slf4j
@Component
public class IngestRetryJob {

    private final IngestRetryQueue queue;
    private final IngestService ingestService;

    public IngestRetryJob(IngestRetryQueue queue, IngestService ingestService) {
        this.queue = queue;
        this.ingestService = ingestService;
    }

    @Scheduled(fixedDelayString = "${chronotrace.ingest.retry-interval:PT30S}",
            initialDelayString = "${chronotrace.ingest.retry-interval:PT30S}")
    public void retryQueued() {
        List<SegmentContent> batch = queue.drain();
        if (batch.isEmpty()) return;
        log.info("Retrying {} segments queued for capacity", batch.size());
        int indexed = 0;
        for (SegmentContent c : batch) {
            try {
                IngestResult r = ingestService.index(c);
                if (r.getStatus() != IngestStatus.QUEUED_FOR_RETRY) indexed++;
            } catch (RuntimeException e) {
                log.warn("Retry of segment {} failed: {}", c.getSegment().getId(), e.getMessage());
            }
        }
        log.info("Capacity retry: {}/{} segments indexed", indexed, batch.size());
    }
}
