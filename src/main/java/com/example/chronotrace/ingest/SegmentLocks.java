package com.example.chronotrace.ingest;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks keyed by segment id. Two calls for the same segment always get the same lock;
 * unrelated segments only contend when their ids hash to the same stripe.
 */
class SegmentLocks {

    private final ReentrantLock[] stripes;

    SegmentLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    ReentrantLock forSegment(String segmentId) {
        return stripes[Math.floorMod(segmentId.hashCode(), stripes.length)];
    }
}
