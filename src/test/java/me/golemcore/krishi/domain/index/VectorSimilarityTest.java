package me.golemcore.krishi.domain.index;

import me.golemcore.krishi.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorSimilarityTest {

    private static final double DELTA = 1e-9;

    @Test
    void shouldReturnOneForIdenticalDirection() {
        assertEquals(1.0, VectorSimilarity.cosine(new float[] { 1, 2, 3 }, new float[] { 2, 4, 6 }), 1e-6);
    }

    @Test
    void shouldReturnZeroForOrthogonalVectors() {
        assertEquals(0.0, VectorSimilarity.cosine(new float[] { 1, 0 }, new float[] { 0, 1 }), DELTA);
    }

    @Test
    void shouldReturnMinusOneForOppositeVectors() {
        assertEquals(-1.0, VectorSimilarity.cosine(new float[] { 1, 1 }, new float[] { -1, -1 }), 1e-6);
    }

    @Test
    void shouldReturnZeroForZeroNorm() {
        assertEquals(0.0, VectorSimilarity.cosine(new float[] { 0, 0 }, new float[] { 1, 1 }), DELTA);
    }

    @Test
    void shouldRejectDimensionMismatch() {
        assertThrows(ValidationException.class,
                () -> VectorSimilarity.cosine(new float[] { 1, 0 }, new float[] { 1, 0, 0 }));
    }

    @Test
    void shouldRejectNullVector() {
        assertThrows(ValidationException.class, () -> VectorSimilarity.cosine(null, new float[] { 1 }));
    }
}
