package com.smartcook.index;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

import com.smartcook.generation.ConfigMismatchException;

public final class BruteForceSimilarityIndex implements SimilarityIndex {
    private final int size;
    private final int dimension;
    private final float[] rows;

    private BruteForceSimilarityIndex(int size, int dimension, float[] rows) {
        this.size = size;
        this.dimension = dimension;
        this.rows = rows;
    }

    public static BruteForceSimilarityIndex build(List<float[]> vectors, int dimension) {
        float[] rows = new float[vectors.size() * dimension];
        for (int id = 0; id < vectors.size(); id++) {
            float[] vector = vectors.get(id);
            if (vector.length != dimension) {
                throw new IllegalArgumentException("Row " + id + " has dimensionality " + vector.length
                        + ", expected " + dimension);
            }
            System.arraycopy(vector, 0, rows, id * dimension, dimension);
        }
        return new BruteForceSimilarityIndex(vectors.size(), dimension, rows);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<Candidate> query(float[] vector, int k) {
        if (vector.length != dimension) {
            throw new ConfigMismatchException("Query vector has dimensionality " + vector.length
                    + " but the index holds " + dimension);
        }
        int limit = Math.min(k, size);
        if (limit <= 0) {
            return List.of();
        }

        PriorityQueue<Candidate> best = new PriorityQueue<>(limit + 1, Candidate.BY_RANK.reversed());
        for (int id = 0; id < size; id++) {
            int offset = id * dimension;
            float dot = 0f;
            for (int i = 0; i < dimension; i++) {
                dot += vector[i] * rows[offset + i];
            }
            best.add(new Candidate(id, dot));
            if (best.size() > limit) {
                best.poll();
            }
        }

        List<Candidate> ranked = new ArrayList<>(best);
        ranked.sort(Candidate.BY_RANK);
        return ranked;
    }

    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(size);
        out.writeInt(dimension);
        for (float value : rows) {
            out.writeFloat(value);
        }
    }

    public static BruteForceSimilarityIndex readFrom(DataInputStream in) throws IOException {
        int size = in.readInt();
        int dimension = in.readInt();
        if (size < 0 || dimension <= 0) {
            throw new IOException("Corrupt similarity index header: size=" + size + " dimension=" + dimension);
        }
        float[] rows = new float[Math.multiplyExact(size, dimension)];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = in.readFloat();
        }
        return new BruteForceSimilarityIndex(size, dimension, rows);
    }
}
