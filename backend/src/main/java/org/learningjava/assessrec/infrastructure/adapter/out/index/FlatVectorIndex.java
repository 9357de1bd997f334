package org.learningjava.assessrec.infrastructure.adapter.out.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Exact inner-product index over L2-normalized vectors (so scores are cosine similarities).
 * Every query is compared against every row; there is no partitioning or quantization.
 * Immutable after construction.
 */
public final class FlatVectorIndex {

    public record ScoredRow(int row, float score) {
    }

    private final int dimension;
    private final int count;
    private final float[] data; // row-major, count * dimension

    private FlatVectorIndex(int dimension, int count, float[] data) {
        this.dimension = dimension;
        this.count = count;
        this.data = data;
    }

    /** Copies and normalizes every vector. All vectors must share {@code dimension}. */
    public static FlatVectorIndex of(int dimension, List<float[]> vectors) {
        if (dimension <= 0 && !vectors.isEmpty()) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        float[] data = new float[vectors.size() * Math.max(dimension, 0)];
        for (int i = 0; i < vectors.size(); i++) {
            float[] v = vectors.get(i);
            if (v == null || v.length != dimension) {
                throw new IllegalArgumentException("vector " + i + " has dimension "
                        + (v == null ? "null" : v.length) + ", expected " + dimension);
            }
            float[] n = normalize(v);
            System.arraycopy(n, 0, data, i * dimension, dimension);
        }
        return new FlatVectorIndex(dimension, vectors.size(), data);
    }

    /** Wraps already-normalized row-major data, as read back from disk. */
    static FlatVectorIndex fromNormalized(int dimension, int count, float[] data) {
        if (data.length != (long) dimension * count) {
            throw new IllegalArgumentException("expected " + ((long) dimension * count) + " floats, got " + data.length);
        }
        return new FlatVectorIndex(dimension, count, data);
    }

    /** L2-normalized copy; a zero vector stays zero. */
    public static float[] normalize(float[] v) {
        double sum = 0.0;
        for (float x : v) sum += (double) x * x;
        float[] out = Arrays.copyOf(v, v.length);
        if (sum == 0.0) return out;
        double norm = Math.sqrt(sum);
        for (int i = 0; i < out.length; i++) out[i] = (float) (out[i] / norm);
        return out;
    }

    public List<ScoredRow> search(float[] query, int topK) {
        int k = Math.min(Math.max(topK, 0), count);
        if (k == 0) return List.of();
        if (query.length != dimension) {
            throw new IllegalArgumentException("query dimension " + query.length
                    + " does not match index dimension " + dimension);
        }

        float[] q = normalize(query);
        List<ScoredRow> all = new ArrayList<>(count);
        for (int row = 0; row < count; row++) {
            int base = row * dimension;
            float dot = 0f;
            for (int j = 0; j < dimension; j++) dot += data[base + j] * q[j];
            all.add(new ScoredRow(row, dot));
        }

        // descending score, then row order
        all.sort(Comparator.comparingDouble((ScoredRow r) -> r.score()).reversed()
                .thenComparingInt(ScoredRow::row));
        return List.copyOf(all.subList(0, k));
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return count;
    }

    float[] rawData() {
        return data;
    }
}
