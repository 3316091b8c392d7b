package com.outlierai.server.ai;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class DistanceOracleTest {

    @Test
    public void testEuclideanIsDefault() {
        DistanceOracle oracle = new DistanceOracle();
        assertEquals("euclidean", oracle.getMetric());

        double[][] d = oracle.distances(new double[][] { { 0.0, 0.0 } }, new double[][] { { 3.0, 4.0 }, { 0.0, 1.0 } });
        assertEquals(1, d.length);
        assertEquals(5.0, d[0][0], 1e-12);
        assertEquals(1.0, d[0][1], 1e-12);
    }

    @Test
    public void testOtherMetrics() {
        double[][] q = { { 0.0, 0.0 } };
        double[][] r = { { 3.0, 4.0 } };
        assertEquals(7.0, new DistanceOracle("manhattan").distances(q, r)[0][0], 1e-12);
        assertEquals(4.0, new DistanceOracle("Chebyshev").distances(q, r)[0][0], 1e-12);
        assertThrows(InvalidInputException.class, () -> new DistanceOracle("cosine-ish"));
    }

    @Test
    public void testSelfDistancesAreSymmetricWithZeroDiagonal() {
        double[][] x = TestData.gaussian(20, 3, 11L);
        double[][] d = new DistanceOracle().selfDistances(x);
        double[][] full = new DistanceOracle().distances(x, x);
        for (int i = 0; i < x.length; i++) {
            assertEquals(0.0, d[i][i], 0.0);
            for (int j = 0; j < x.length; j++) {
                assertEquals(d[i][j], d[j][i], 0.0);
                assertEquals(full[i][j], d[i][j], 1e-12);
            }
        }
    }

    @Test
    public void testDimensionMismatchIsRejected() {
        DistanceOracle oracle = new DistanceOracle();
        assertThrows(InvalidInputException.class,
                () -> oracle.distances(new double[][] { { 1.0, 2.0 } }, new double[][] { { 1.0, 2.0, 3.0 } }));
    }

    @Test
    public void testNearestBreaksTiesByReferenceIndex() {
        double[] row = { 2.0, 1.0, 1.0, 0.5, 1.0 };
        assertArrayEquals(new int[] { 3, 1, 2 }, DistanceOracle.nearest(row, 3, -1));
        // skipping index 3 (the query itself)
        assertArrayEquals(new int[] { 1, 2, 4 }, DistanceOracle.nearest(row, 3, 3));
        assertThrows(InvalidInputException.class, () -> DistanceOracle.nearest(row, 5, 0));
    }
}
