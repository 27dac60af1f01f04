package com.example.chronotrace.embedding;

import jakarta.persistence.*;

@Entity
@Table(name = "embedding_cache")
public class EmbeddingCacheRecord {

    @Id
    @Column(name = "fingerprint", length = 64)
    private String fingerprint;

    @Column(name = "checksum", nullable = false)
    private String checksum;

    // compressed binary embedding blob (GZIPped float bytes)
    @Lob
    @Column(name = "vector_blob", columnDefinition = "BLOB", nullable = false)
    private byte[] vectorBlob;

    @Column(name = "dimension")
    private int dimension;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    public EmbeddingCacheRecord() {}

    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public byte[] getVectorBlob() { return vectorBlob; }
    public void setVectorBlob(byte[] vectorBlob) { this.vectorBlob = vectorBlob; }
    public int getDimension() { return dimension; }
    public void setDimension(int dimension) { this.dimension = dimension; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
}
