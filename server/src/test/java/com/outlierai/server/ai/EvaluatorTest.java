package com.outlierai.server.ai;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {

    @Test
    public void testPerfectAndInvertedRanking() {
        int[] y = { 0, 0, 0, 1, 1 };
        assertEquals(1.0, Evaluator.rocAuc(y, new double[] { 0.1, 0.2, 0.3, 0.8, 0.9 }), 1e-12);
        assertEquals(0.0, Evaluator.rocAuc(y, new double[] { 0.9, 0.8, 0.7, 0.2, 0.1 }), 1e-12);
    }

    @Test
    public void testTiesCountHalf() {
        int[] y = { 0, 1 };
        assertEquals(0.5, Evaluator.rocAuc(y, new double[] { 1.0, 1.0 }), 1e-12);
    }

    @Test
    public void testRocNeedsBothClasses() {
        assertThrows(InvalidInputException.class, () -> Evaluator.rocAuc(new int[] { 0, 0 }, new double[] { 1.0, 2.0 }));
    }

    @Test
    public void testPrecisionAtN() {
        int[] y = { 0, 0, 0, 0, 0, 0, 0, 0, 1, 1 };
        double[] scores = { 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.95, 0.9, 0.8 };
        // top two rows are indices 7 and 8, one of them is a true outlier
        assertEquals(0.5, Evaluator.precisionAtN(y, scores), 1e-12);
        assertEquals(1.0, Evaluator.precisionAtN(y, new double[] { 0, 0, 0, 0, 0, 0, 0, 0, 5, 6 }), 1e-12);
    }
}
