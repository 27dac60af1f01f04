package com.example.chronotrace.embedding;

import java.util.Arrays;

/**
 * Immutable embedding. The backing array is copied on the way in and on the way out.
 */
public final class EmbeddingVector {

    private final float[] values;

    private EmbeddingVector(float[] values) {
        this.values = values;
    }

    public static EmbeddingVector of(float[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("embedding must have at least one component");
        }
        return new EmbeddingVector(Arrays.copyOf(values, values.length));
    }

    public int dimension() {
        return values.length;
    }

    public float[] toArray() {
        return Arrays.copyOf(values, values.length);
    }

    public float get(int i) {
        return values[i];
    }

    public double norm() {
        double sum = 0;
        for (float v : values) sum += v * v;
        return Math.sqrt(sum);
    }

    /**
     * Unit-length copy. A zero vector is returned unchanged.
     */
    public EmbeddingVector normalized() {
        double n = norm();
        if (n == 0) return this;
        float[] out = new float[values.length];
        for (int i = 0; i < values.length; i++) out[i] = (float) (values[i] / n);
        return new EmbeddingVector(out);
    }

    /**
     * Cosine similarity in [-1, 1]; -1 when either side is a zero vector or the dimensions differ.
     */
    public double cosine(EmbeddingVector other) {
        return cosine(values, other.values);
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) return -1.0;
        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return -1.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector)) return false;
        return Arrays.equals(values, ((EmbeddingVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dim=" + values.length + "]";
    }
}
