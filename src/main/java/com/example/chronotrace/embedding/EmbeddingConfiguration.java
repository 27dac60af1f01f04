package com.example.chronotrace.embedding;

import com.example.chronotrace.config.ChronoTraceProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The two embedding caches are built once per process and handed to the pipeline: segments
 * get the long TTL and the durable store, query text only a short-lived memory cache.
 */
@Configuration
public class EmbeddingConfiguration {

    @Bean
    public EmbeddingCache segmentEmbeddingCache(ChronoTraceProperties properties,
                                                ObjectProvider<EmbeddingCacheStore> store) {
        ChronoTraceProperties.EmbeddingConfig cfg = properties.getEmbedding();
        return new EmbeddingCache("segment", cfg.getSegmentTtl(), cfg.getMaxEntries(), store.getIfAvailable());
    }

    @Bean
    public EmbeddingCache queryEmbeddingCache(ChronoTraceProperties properties) {
        ChronoTraceProperties.EmbeddingConfig cfg = properties.getEmbedding();
        return new EmbeddingCache("query", cfg.getQueryTtl(), cfg.getMaxEntries(), null);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService embeddingCallExecutor() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "embedding-call-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
