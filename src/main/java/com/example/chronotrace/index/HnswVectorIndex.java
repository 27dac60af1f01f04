package com.example.chronotrace.index;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.embedding.EmbeddingVector;
import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.Item;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * HNSW graph (jelmerk hnswlib, cosine distance) over all points, plus an id to point map that
 * holds the metadata and the exact vectors.
 *
 * <p>Filtering happens before ranking. When the filtered candidate set is small enough it is
 * ranked exactly. Otherwise the graph is walked with a widening {@code k}; only candidates that
 * pass the filters are kept, and the walk stops once {@code topK} of them are collected, the
 * graph yields a point under the score threshold, or every point has been visited. Scores of
 * the kept candidates are recomputed exactly, so ordering and thresholds are exact; recall on
 * this path is that of the graph at the configured {@code ef}.</p>
 */
@Service
@Profile("!exact-index")
public class HnswVectorIndex extends AbstractVectorIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    private static final int MIN_GRAPH_K = 32;
    private static final int OVERSAMPLE = 4;

    private final Map<String, IndexPoint> points = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong versions = new AtomicLong();

    // created on first insert, once the dimension is known
    private HnswIndex<String, float[], GraphItem, Float> graph;
    private int dimension = -1;

    private final int m;
    private final int efConstruction;
    private final int ef;
    private final int exactSearchThreshold;

    @Autowired
    public HnswVectorIndex(ChronoTraceProperties properties,
                           @Value("${hnsw.m:16}") int m,
                           @Value("${hnsw.ef-construction:200}") int efConstruction,
                           @Value("${hnsw.ef:64}") int ef) {
        this(m, efConstruction, ef, properties.getIndex().getMaxItems(), properties.getIndex().getExactSearchThreshold());
    }

    // package-private constructor for tests to configure small HNSW params
    HnswVectorIndex(int m, int efConstruction, int ef, int maxItems, int exactSearchThreshold) {
        super(maxItems);
        this.m = m;
        this.efConstruction = efConstruction;
        this.ef = ef;
        this.exactSearchThreshold = exactSearchThreshold;
    }

    private HnswIndex<String, float[], GraphItem, Float> newGraph(int dim) {
        return HnswIndex.newBuilder(dim, DistanceFunctions.FLOAT_COSINE_DISTANCE, maxItems)
                .withM(m)
                .withEfConstruction(efConstruction)
                .withEf(ef)
                .withRemoveEnabled()
                .build();
    }

    @Override
    public void upsert(IndexPoint point) {
        int dim = point.getVector().dimension();
        lock.writeLock().lock();
        try {
            if (dimension != -1 && dimension != dim) {
                throw new IllegalArgumentException("point " + point.getId() + " has dimension " + dim
                        + " but the index holds " + dimension);
            }
            boolean exists = points.containsKey(point.getId());
            checkCapacity(point.getId(), exists, points.size());
            if (graph == null) {
                dimension = dim;
                graph = newGraph(dim);
            }
            long version = versions.incrementAndGet();
            if (exists) {
                graph.remove(point.getId(), version);
            }
            addToGraph(new GraphItem(point.getId(), point.getVector().normalized().toArray(), version));
            points.put(point.getId(), point);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void addToGraph(GraphItem item) {
        try {
            graph.add(item);
        } catch (RuntimeException full) {
            // removed nodes still hold graph slots; compact and retry once
            log.info("HNSW graph rejected insert ({}); compacting {} live points", full.getMessage(), points.size());
            graph = compacted(item.id());
            graph.add(item);
        }
    }

    private HnswIndex<String, float[], GraphItem, Float> compacted(String skipId) {
        HnswIndex<String, float[], GraphItem, Float> fresh = newGraph(dimension);
        for (IndexPoint p : points.values()) {
            if (p.getId().equals(skipId)) continue;
            fresh.add(new GraphItem(p.getId(), p.getVector().normalized().toArray(), versions.incrementAndGet()));
        }
        return fresh;
    }

    @Override
    public boolean remove(String pointId) {
        lock.writeLock().lock();
        try {
            IndexPoint removed = points.remove(pointId);
            if (removed == null) return false;
            graph.remove(pointId, versions.incrementAndGet());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<IndexPoint> get(String pointId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(points.get(pointId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ScoredPoint> search(EmbeddingVector query, SearchFilters filters, int topK, double scoreThreshold) {
        if (topK <= 0) return List.of();
        lock.readLock().lock();
        try {
            if (graph == null || points.isEmpty()) return List.of();
            if (query.dimension() != dimension) {
                throw new IllegalArgumentException("query dimension " + query.dimension() + " does not match index dimension " + dimension);
            }
            if (filters.isEmpty()) {
                if (points.size() <= exactSearchThreshold) {
                    return rankExact(points.values(), query, filters, topK, scoreThreshold);
                }
                return walkGraph(query, filters, topK, scoreThreshold);
            }
            List<IndexPoint> candidates = new ArrayList<>();
            for (IndexPoint p : points.values()) {
                if (filters.matches(p.getMetadata())) candidates.add(p);
            }
            if (candidates.size() <= exactSearchThreshold) {
                return rankExact(candidates, query, SearchFilters.none(), topK, scoreThreshold);
            }
            return walkGraph(query, filters, topK, scoreThreshold);
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<ScoredPoint> walkGraph(EmbeddingVector query, SearchFilters filters, int topK, double scoreThreshold) {
        float[] q = query.normalized().toArray();
        int total = points.size();
        int k = Math.min(total, Math.max(MIN_GRAPH_K, topK * OVERSAMPLE));
        Map<String, ScoredPoint> kept = new LinkedHashMap<>();
        while (true) {
            checkInterrupted();
            boolean belowThreshold = false;
            List<SearchResult<GraphItem, Float>> nearest = graph.findNearest(q, k);
            for (SearchResult<GraphItem, Float> r : nearest) {
                IndexPoint p = points.get(r.item().id());
                if (p == null) continue;
                double score = query.cosine(p.getVector());
                if (score < scoreThreshold) {
                    belowThreshold = true;
                    break;
                }
                if (filters.matches(p.getMetadata())) {
                    kept.putIfAbsent(p.getId(), new ScoredPoint(p.getId(), p.getSegmentId(), score, p.getMetadata()));
                }
            }
            if (kept.size() >= topK || belowThreshold || k >= total) break;
            k = Math.min(total, k * 2);
        }
        List<ScoredPoint> out = new ArrayList<>(kept.values());
        out.sort(ScoredPoint.RANKING);
        return out.size() > topK ? new ArrayList<>(out.subList(0, topK)) : out;
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return points.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void replaceAll(List<IndexPoint> loaded) {
        lock.writeLock().lock();
        try {
            points.clear();
            graph = null;
            dimension = -1;
            for (IndexPoint p : loaded) {
                if (points.size() >= maxItems) {
                    log.warn("Rebuild stopped at capacity {}; remaining persisted points not loaded", maxItems);
                    break;
                }
                if (dimension == -1) {
                    dimension = p.getVector().dimension();
                    graph = newGraph(dimension);
                } else if (p.getVector().dimension() != dimension) {
                    log.warn("Skipping point {} with dimension {} (index dimension {})", p.getId(), p.getVector().dimension(), dimension);
                    continue;
                }
                graph.add(new GraphItem(p.getId(), p.getVector().normalized().toArray(), versions.incrementAndGet()));
                points.put(p.getId(), p);
            }
            log.info("HNSW index rebuilt with {} points (dimension={})", points.size(), dimension);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Integer> getHnswParams() {
        Map<String, Integer> out = new LinkedHashMap<>();
        out.put("m", m);
        out.put("efConstruction", efConstruction);
        out.put("ef", ef);
        out.put("maxItems", maxItems);
        out.put("exactSearchThreshold", exactSearchThreshold);
        return out;
    }

    public int getDimensions() {
        return dimension;
    }

    // hnswlib item carrying a unit-length copy of the point's vector
    static final class GraphItem implements Item<String, float[]> {
        private static final long serialVersionUID = 1L;

        private final String id;
        private final float[] vector;
        private final long version;

        GraphItem(String id, float[] vector, long version) {
            this.id = id;
            this.vector = vector;
            this.version = version;
        }

        @Override
        public String id() { return id; }

        @Override
        public float[] vector() { return vector; }

        @Override
        public int dimensions() { return vector.length; }

        @Override
        public long version() { return version; }
    }
}
