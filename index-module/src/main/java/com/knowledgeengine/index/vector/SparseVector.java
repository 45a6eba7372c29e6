package com.knowledgeengine.index.vector;

import java.util.Arrays;

/**
 * Sparse row of a term matrix. Column indices are strictly ascending.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

    private final int[] indices;
    private final double[] values;

    SparseVector(int[] indices, double[] values) {
        if (indices.length != values.length) {
            throw new IllegalArgumentException("Indices and values must have the same length");
        }
        for (int i = 1; i < indices.length; i++) {
            if (indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("Indices must be strictly ascending");
            }
        }
        this.indices = indices;
        this.values = values;
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public static SparseVector of(int[] indices, double[] values) {
        return new SparseVector(indices.clone(), values.clone());
    }

    public int nonZeroCount() {
        return indices.length;
    }

    public boolean isZero() {
        for (double value : values) {
            if (value != 0.0) {
                return false;
            }
        }
        return true;
    }

    /** Значение в колонке или 0.0 */
    public double get(int column) {
        int position = Arrays.binarySearch(indices, column);
        return position >= 0 ? values[position] : 0.0;
    }

    public double dot(SparseVector other) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += values[i] * other.values[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    public double norm() {
        double sum = 0.0;
        for (double value : values) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy; the zero vector is returned unchanged
     */
    public SparseVector normalized() {
        double norm = norm();
        if (norm == 0.0) {
            return this;
        }
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] / norm;
        }
        return new SparseVector(indices, scaled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseVector other)) {
            return false;
        }
        return Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SparseVector{");
        for (int i = 0; i < indices.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(indices[i]).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
