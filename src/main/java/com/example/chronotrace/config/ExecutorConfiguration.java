package com.example.chronotrace.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for ingest and search. Ingest is bounded by the embedding concurrency; search
 * requests are independent and may run in parallel.
 */
@Configuration
public class ExecutorConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ingestExecutor(ChronoTraceProperties properties) {
        int workers = Math.max(1, properties.getEmbedding().getConcurrency());
        return Executors.newFixedThreadPool(workers, daemon("ingest-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor() {
        return Executors.newCachedThreadPool(daemon("search-worker-"));
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
