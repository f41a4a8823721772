package com.smartcook.index;

import java.util.List;

public interface SimilarityIndex {
    int size();

    int dimension();

    List<Candidate> query(float[] vector, int k);
}
