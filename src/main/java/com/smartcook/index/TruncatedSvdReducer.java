package com.smartcook.index;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.QRDecomposition;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartcook.text.HashedVector;

/**
 * Fits a rank-K projection of hashed vectors with a randomized range finder followed by an
 * exact SVD of the small sketch (Halko, Martinsson and Tropp). Only hash columns present in the
 * training rows carry weight; every other column projects to zero.
 */
public class TruncatedSvdReducer {
    private static final Logger log = LoggerFactory.getLogger(TruncatedSvdReducer.class);

    private final int components;
    private final int oversamples;
    private final int powerIterations;
    private final long seed;

    public TruncatedSvdReducer(int components, int oversamples, int powerIterations, long seed) {
        if (components <= 0) {
            throw new IllegalArgumentException("components must be positive: " + components);
        }
        this.components = components;
        this.oversamples = Math.max(0, oversamples);
        this.powerIterations = Math.max(0, powerIterations);
        this.seed = seed;
    }

    public int components() {
        return components;
    }

    public ReducerParameters fit(List<HashedVector> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a reducer on zero rows");
        }
        int dimension = vectors.get(0).dimension();
        SparseRowMatrix matrix = SparseRowMatrix.from(vectors, dimension);
        int columns = matrix.columns();
        int attainableRank = Math.min(matrix.rows(), columns);

        float[] componentValues = new float[components * columns];
        double[] singularValues = new double[components];
        if (attainableRank == 0) {
            log.warn("All {} rows are empty; reducer projects everything to the zero vector", matrix.rows());
            return new ReducerParameters(dimension, components, matrix.activeColumns(), componentValues, singularValues);
        }

        int sketchWidth = Math.min(components + oversamples, attainableRank);
        Random random = new Random(seed);
        DMatrixRMaj omega = new DMatrixRMaj(columns, sketchWidth);
        for (int i = 0; i < omega.data.length; i++) {
            omega.data[i] = random.nextGaussian();
        }

        DMatrixRMaj range = orthonormalize(matrix.multiply(omega));
        for (int iteration = 0; iteration < powerIterations; iteration++) {
            DMatrixRMaj coRange = orthonormalize(matrix.transposeMultiply(range));
            range = orthonormalize(matrix.multiply(coRange));
        }

        DMatrixRMaj sketchTransposed = matrix.transposeMultiply(range);
        SingularValueDecomposition_F64<DMatrixRMaj> svd = DecompositionFactory_DDRM.svd(
                sketchTransposed.numRows, sketchTransposed.numCols, true, false, true);
        if (!svd.decompose(sketchTransposed)) {
            throw new IllegalStateException("SVD of the " + sketchTransposed.numRows + "x" + sketchTransposed.numCols
                    + " sketch did not converge");
        }
        DMatrixRMaj leftVectors = svd.getU(null, false);
        double[] sigma = svd.getSingularValues();
        int found = svd.numberOfSingularValues();
        int[] order = IntStream.range(0, found)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> sigma[i]).reversed().thenComparingInt(i -> i))
                .mapToInt(Integer::intValue)
                .toArray();

        int kept = Math.min(components, found);
        for (int k = 0; k < kept; k++) {
            int source = order[k];
            singularValues[k] = sigma[source];
            double sign = dominantSign(leftVectors, source);
            for (int column = 0; column < columns; column++) {
                componentValues[k * columns + column] = (float) (sign * leftVectors.get(column, source));
            }
        }

        log.info("Fitted truncated SVD rows={} activeColumns={} components={} attainableRank={} leadingSingularValues={}",
                matrix.rows(),
                columns,
                components,
                attainableRank,
                Arrays.toString(Arrays.copyOf(singularValues, Math.min(5, kept))));
        return new ReducerParameters(dimension, components, matrix.activeColumns(), componentValues, singularValues);
    }

    private static DMatrixRMaj orthonormalize(DMatrixRMaj matrix) {
        QRDecomposition<DMatrixRMaj> qr = DecompositionFactory_DDRM.qr(matrix.numRows, matrix.numCols);
        if (!qr.decompose(matrix)) {
            throw new IllegalStateException("QR decomposition failed");
        }
        return qr.getQ(null, true);
    }

    private static double dominantSign(DMatrixRMaj vectors, int column) {
        double largest = 0.0;
        double sign = 1.0;
        for (int row = 0; row < vectors.numRows; row++) {
            double value = vectors.get(row, column);
            if (Math.abs(value) > largest) {
                largest = Math.abs(value);
                sign = value < 0 ? -1.0 : 1.0;
            }
        }
        return sign;
    }
}
