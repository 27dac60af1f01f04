package com.example.chronotrace.index;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.embedding.EmbeddingVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact scan over every point. Correct for any size, used for small deployments and as the
 * oracle the approximate index is checked against.
 */
@Service
@Profile("exact-index")
public class BruteForceVectorIndex extends AbstractVectorIndex {

    private static final Logger log = LoggerFactory.getLogger(BruteForceVectorIndex.class);

    private final Map<String, IndexPoint> store = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public BruteForceVectorIndex(ChronoTraceProperties properties) {
        this(properties.getIndex().getMaxItems());
    }

    public BruteForceVectorIndex(int maxItems) {
        super(maxItems);
    }

    @Override
    public void upsert(IndexPoint point) {
        lock.writeLock().lock();
        try {
            checkCapacity(point.getId(), store.containsKey(point.getId()), store.size());
            store.put(point.getId(), point);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String pointId) {
        lock.writeLock().lock();
        try {
            return store.remove(pointId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<IndexPoint> get(String pointId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(store.get(pointId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ScoredPoint> search(EmbeddingVector query, SearchFilters filters, int topK, double scoreThreshold) {
        lock.readLock().lock();
        try {
            return rankExact(store.values(), query, filters, topK, scoreThreshold);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try { return store.size(); } finally { lock.readLock().unlock(); }
    }

    @Override
    protected void replaceAll(List<IndexPoint> points) {
        lock.writeLock().lock();
        try {
            store.clear();
            for (IndexPoint p : points) {
                if (store.size() >= maxItems) {
                    log.warn("Rebuild stopped at capacity {}; {} persisted points not loaded", maxItems, points.size() - store.size());
                    break;
                }
                store.put(p.getId(), p);
            }
            log.info("Exact index rebuilt with {} points", store.size());
        } finally {
            lock.writeLock().unlock();
        }
    }
}
