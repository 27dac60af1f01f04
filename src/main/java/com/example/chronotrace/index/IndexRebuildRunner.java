package com.example.chronotrace.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reloads the in-memory index from the persisted points at startup. Disable with
 * {@code chronotrace.index.rebuild-on-startup=false}.
 */
@Component
@ConditionalOnProperty(name = "chronotrace.index.rebuild-on-startup", havingValue = "true", matchIfMissing = true)
public class IndexRebuildRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexRebuildRunner.class);

    private final VectorIndex index;

    public IndexRebuildRunner(VectorIndex index) {
        this.index = index;
    }

    @Override
    public void run(String... args) {
        log.info("IndexRebuildRunner: rebuilding {} from persisted points...", index.kind());
        try {
            index.rebuildFromDatabase();
            log.info("IndexRebuildRunner: finished; index size={}", index.size());
        } catch (RuntimeException e) {
            log.error("IndexRebuildRunner: rebuild failed, starting with an empty index: {}", e.getMessage(), e);
        }
    }
}
