package com.example.chronotrace.ingest;

/**
 * A segment together with the bytes used for fingerprinting and embedding. The array is
 * shared, not copied; callers must not modify it after handing it over.
 */
public final class SegmentContent {

    private final Segment segment;
    private final byte[] content;

    public SegmentContent(Segment segment, byte[] content) {
        if (segment == null) throw new IllegalArgumentException("segment is required");
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("segment " + segment.getId() + " has no content");
        }
        this.segment = segment;
        this.content = content;
    }

    public Segment getSegment() {
        return segment;
    }

    public byte[] getContent() {
        return content;
    }

    public int size() {
        return content.length;
    }
}
