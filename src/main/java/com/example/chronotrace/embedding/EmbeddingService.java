package com.example.chronotrace.embedding;

/**
 * External embedding model. Calls are slow and metered; the pipeline makes sure each distinct
 * content reaches it at most once per cache lifetime.
 */
public interface EmbeddingService {

    /**
     * Embed the raw bytes of a video segment.
     *
     * @throws EmbeddingServiceException on failure, classified transient or permanent
     */
    float[] embedVideo(byte[] content);

    /**
     * Embed a natural-language query into the same space as segments.
     */
    float[] embedText(String text);

    int dimension();
}
