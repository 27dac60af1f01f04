package com.example.chronotrace.embedding;

/**
 * Failure reported by an embedding service adapter.
 */
public class EmbeddingServiceException extends RuntimeException {

    private final Kind kind;

    public EmbeddingServiceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EmbeddingServiceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public enum Kind {
        TRANSIENT,  // timeout, rate limit, 5xx
        PERMANENT   // malformed or unsupported input
    }
}
