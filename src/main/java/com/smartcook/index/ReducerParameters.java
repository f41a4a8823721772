package com.smartcook.index;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

import com.smartcook.generation.ConfigMismatchException;
import com.smartcook.text.HashedVector;

public final class ReducerParameters {
    private final int hashDimension;
    private final int components;
    private final int[] activeColumns;
    private final float[] componentValues;
    private final double[] singularValues;

    ReducerParameters(int hashDimension, int components, int[] activeColumns, float[] componentValues, double[] singularValues) {
        if (componentValues.length != components * activeColumns.length) {
            throw new IllegalArgumentException("Component matrix has " + componentValues.length + " entries, expected "
                    + components * activeColumns.length);
        }
        if (singularValues.length != components) {
            throw new IllegalArgumentException("Expected " + components + " singular values but got " + singularValues.length);
        }
        this.hashDimension = hashDimension;
        this.components = components;
        this.activeColumns = activeColumns;
        this.componentValues = componentValues;
        this.singularValues = singularValues;
    }

    public int hashDimension() {
        return hashDimension;
    }

    public int components() {
        return components;
    }

    public int activeColumnCount() {
        return activeColumns.length;
    }

    double[] singularValues() {
        return singularValues.clone();
    }

    public float[] project(HashedVector vector) {
        if (vector.dimension() != hashDimension) {
            throw new ConfigMismatchException("Hashed vector has dimensionality " + vector.dimension()
                    + " but the reducer was fitted on " + hashDimension);
        }
        int columns = activeColumns.length;
        double[] accumulator = new double[components];
        for (int p = 0; p < vector.nonZeroCount(); p++) {
            int position = Arrays.binarySearch(activeColumns, vector.indexAt(p));
            if (position < 0) {
                continue;
            }
            double value = vector.valueAt(p);
            for (int k = 0; k < components; k++) {
                accumulator[k] += value * componentValues[k * columns + position];
            }
        }

        double norm = 0.0;
        for (double v : accumulator) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        float[] projected = new float[components];
        if (norm > 0.0) {
            for (int k = 0; k < components; k++) {
                projected[k] = (float) (accumulator[k] / norm);
            }
        }
        return projected;
    }

    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(hashDimension);
        out.writeInt(components);
        out.writeInt(activeColumns.length);
        for (int column : activeColumns) {
            out.writeInt(column);
        }
        for (double value : singularValues) {
            out.writeDouble(value);
        }
        for (float value : componentValues) {
            out.writeFloat(value);
        }
    }

    public static ReducerParameters readFrom(DataInputStream in) throws IOException {
        int hashDimension = in.readInt();
        int components = in.readInt();
        int columns = in.readInt();
        if (hashDimension <= 0 || components <= 0 || columns < 0 || columns > hashDimension) {
            throw new IOException("Corrupt reducer header: dimension=" + hashDimension
                    + " components=" + components + " columns=" + columns);
        }
        int[] activeColumns = new int[columns];
        for (int i = 0; i < columns; i++) {
            activeColumns[i] = in.readInt();
        }
        double[] singularValues = new double[components];
        for (int i = 0; i < components; i++) {
            singularValues[i] = in.readDouble();
        }
        float[] componentValues = new float[components * columns];
        for (int i = 0; i < componentValues.length; i++) {
            componentValues[i] = in.readFloat();
        }
        return new ReducerParameters(hashDimension, components, activeColumns, componentValues, singularValues);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ReducerParameters that)) {
            return false;
        }
        return hashDimension == that.hashDimension
                && components == that.components
                && Arrays.equals(activeColumns, that.activeColumns)
                && Arrays.equals(componentValues, that.componentValues)
                && Arrays.equals(singularValues, that.singularValues);
    }

    @Override
    public int hashCode() {
        int result = 31 * hashDimension + components;
        result = 31 * result + Arrays.hashCode(activeColumns);
        return 31 * result + Arrays.hashCode(componentValues);
    }
}
