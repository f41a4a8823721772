package com.smartcook.index;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import org.ejml.data.DMatrixRMaj;

import com.smartcook.text.HashedVector;

final class SparseRowMatrix {
    private final int rows;
    private final int[] activeColumns;
    private final int[] rowPointers;
    private final int[] columnPositions;
    private final double[] values;

    private SparseRowMatrix(int rows, int[] activeColumns, int[] rowPointers, int[] columnPositions, double[] values) {
        this.rows = rows;
        this.activeColumns = activeColumns;
        this.rowPointers = rowPointers;
        this.columnPositions = columnPositions;
        this.values = values;
    }

    static SparseRowMatrix from(List<HashedVector> vectors, int dimension) {
        BitSet seen = new BitSet(dimension);
        int nonZeros = 0;
        for (HashedVector vector : vectors) {
            if (vector.dimension() != dimension) {
                throw new IllegalArgumentException("Mixed hashed dimensionality: expected " + dimension
                        + " but found " + vector.dimension());
            }
            for (int p = 0; p < vector.nonZeroCount(); p++) {
                seen.set(vector.indexAt(p));
            }
            nonZeros += vector.nonZeroCount();
        }
        int[] activeColumns = seen.stream().toArray();

        int[] rowPointers = new int[vectors.size() + 1];
        int[] columnPositions = new int[nonZeros];
        double[] values = new double[nonZeros];
        int cursor = 0;
        for (int row = 0; row < vectors.size(); row++) {
            HashedVector vector = vectors.get(row);
            for (int p = 0; p < vector.nonZeroCount(); p++) {
                columnPositions[cursor] = Arrays.binarySearch(activeColumns, vector.indexAt(p));
                values[cursor] = vector.valueAt(p);
                cursor++;
            }
            rowPointers[row + 1] = cursor;
        }
        return new SparseRowMatrix(vectors.size(), activeColumns, rowPointers, columnPositions, values);
    }

    int rows() {
        return rows;
    }

    int columns() {
        return activeColumns.length;
    }

    int[] activeColumns() {
        return activeColumns.clone();
    }

    DMatrixRMaj multiply(DMatrixRMaj right) {
        int width = right.numCols;
        DMatrixRMaj out = new DMatrixRMaj(rows, width);
        double[] target = out.data;
        double[] source = right.data;
        for (int row = 0; row < rows; row++) {
            int rowOffset = row * width;
            for (int p = rowPointers[row]; p < rowPointers[row + 1]; p++) {
                double value = values[p];
                int sourceOffset = columnPositions[p] * width;
                for (int j = 0; j < width; j++) {
                    target[rowOffset + j] += value * source[sourceOffset + j];
                }
            }
        }
        return out;
    }

    DMatrixRMaj transposeMultiply(DMatrixRMaj left) {
        int width = left.numCols;
        DMatrixRMaj out = new DMatrixRMaj(columns(), width);
        double[] target = out.data;
        double[] source = left.data;
        for (int row = 0; row < rows; row++) {
            int rowOffset = row * width;
            for (int p = rowPointers[row]; p < rowPointers[row + 1]; p++) {
                double value = values[p];
                int targetOffset = columnPositions[p] * width;
                for (int j = 0; j < width; j++) {
                    target[targetOffset + j] += value * source[rowOffset + j];
                }
            }
        }
        return out;
    }
}
