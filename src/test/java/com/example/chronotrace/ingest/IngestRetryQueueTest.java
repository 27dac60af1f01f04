package com.example.chronotrace.ingest;

import com.example.chronotrace.error.IndexCapacityException;
import org.junit.jupiter.api.Test;

import static com.example.chronotrace.ingest.IngestServiceTest.content;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IngestRetryQueueTest {

    @Test
    public void segmentIsQueuedOnceWithLatestContent() {
        IngestRetryQueue queue = new IngestRetryQueue(10);
        queue.enqueue(content("s1", "old"));
        queue.enqueue(content("s2", "other"));
        queue.enqueue(content("s1", "new"));

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.drain())
                .extracting(c -> new String(c.getContent()))
                .containsExactly("new", "other");
        assertThat(queue.size()).isZero();
    }

    @Test
    public void fullQueueRejectsNewSegments() {
        IngestRetryQueue queue = new IngestRetryQueue(1);
        queue.enqueue(content("s1", "a"));
        queue.enqueue(content("s1", "b"));

        assertThatThrownBy(() -> queue.enqueue(content("s2", "c")))
                .isInstanceOf(IndexCapacityException.class)
                .hasMessageContaining("retry queue");
    }
}
