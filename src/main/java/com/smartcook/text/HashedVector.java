package com.smartcook.text;

import java.util.Arrays;

public final class HashedVector {
    private final int dimension;
    private final int[] indices;
    private final float[] values;

    public HashedVector(int dimension, int[] indices, float[] values) {
        if (indices.length != values.length) {
            throw new IllegalArgumentException("indices and values differ in length");
        }
        this.dimension = dimension;
        this.indices = indices.clone();
        this.values = values.clone();
        for (int i = 0; i < this.indices.length; i++) {
            if (this.indices[i] < 0 || this.indices[i] >= dimension) {
                throw new IllegalArgumentException("Index " + this.indices[i] + " outside dimension " + dimension);
            }
            if (i > 0 && this.indices[i] <= this.indices[i - 1]) {
                throw new IllegalArgumentException("Indices must be strictly increasing");
            }
        }
    }

    public static HashedVector empty(int dimension) {
        return new HashedVector(dimension, new int[0], new float[0]);
    }

    public int dimension() {
        return dimension;
    }

    public int nonZeroCount() {
        return indices.length;
    }

    public int indexAt(int position) {
        return indices[position];
    }

    public float valueAt(int position) {
        return values[position];
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HashedVector that)) {
            return false;
        }
        return dimension == that.dimension
                && Arrays.equals(indices, that.indices)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * dimension + Arrays.hashCode(indices)) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "HashedVector[dimension=" + dimension + ", nnz=" + indices.length + "]";
    }
}
