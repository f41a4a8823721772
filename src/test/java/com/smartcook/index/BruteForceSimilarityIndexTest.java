package com.smartcook.index;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.smartcook.fixture.RecipeFixtures;
import com.smartcook.generation.ConfigMismatchException;

class BruteForceSimilarityIndexTest {

    private final BruteForceSimilarityIndex index = BruteForceSimilarityIndex.build(List.of(
            new float[] { 1f, 0f },
            new float[] { 0f, 1f },
            new float[] { 0.6f, 0.8f },
            new float[] { 1f, 0f },
            new float[] { -1f, 0f }), 2);

    @Test
    void shouldRankByDescendingCosineAndBreakTiesById() {
        List<Candidate> candidates = index.query(new float[] { 1f, 0f }, 5);
        assertEquals(List.of(0, 3, 2, 1, 4), candidates.stream().map(Candidate::id).toList());
        assertEquals(1f, candidates.get(0).similarity(), 1e-6f);
        assertEquals(-1f, candidates.get(4).similarity(), 1e-6f);
    }

    @Test
    void shouldKeepOnlyTheTopK() {
        List<Candidate> candidates = index.query(new float[] { 0f, 1f }, 2);
        assertEquals(List.of(1, 2), candidates.stream().map(Candidate::id).toList());
    }

    @Test
    void shouldCapKAtIndexSize() {
        assertEquals(5, index.query(new float[] { 0.6f, 0.8f }, 100).size());
        assertTrue(index.query(new float[] { 0.6f, 0.8f }, 0).isEmpty());
    }

    @Test
    void shouldTreatZeroQueryAsAllTiesInIdOrder() {
        List<Candidate> candidates = index.query(new float[] { 0f, 0f }, 3);
        assertEquals(List.of(0, 1, 2), candidates.stream().map(Candidate::id).toList());
    }

    @Test
    void shouldExposeSizeAndDimension() {
        assertEquals(5, index.size());
        assertEquals(2, index.dimension());
        assertArrayEquals(new float[] { 0.6f, 0.8f }, RecipeFixtures.rowsOf(index)[2]);
    }

    @Test
    void shouldRejectQueryOfWrongDimensionality() {
        assertThrows(ConfigMismatchException.class, () -> index.query(new float[] { 1f, 0f, 0f }, 3));
    }
}
