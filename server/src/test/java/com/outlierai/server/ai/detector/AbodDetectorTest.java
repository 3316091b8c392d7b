package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.DegenerateDistributionException;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.TestData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AbodDetectorTest {

    @Test
    public void testFullAbodFlagsIsolatedTrainingPoint() {
        double[][] x = TestData.gaussianWith(40, 2, 8L, new double[] { 10.0, 10.0 });
        AbodDetector abod = AbodDetector.full();
        abod.fit(x);

        double[] scores = abod.getDecisionScores();
        assertEquals(40, TestData.argmax(scores));
        for (double s : scores) {
            assertTrue(s <= 0.0, "negated variance must not be positive");
        }
        assertEquals(1, abod.getLabels()[40]);
    }

    @Test
    public void testFastAbodFlagsIsolatedTrainingPoint() {
        double[][] x = TestData.gaussianWith(60, 2, 9L, new double[] { -9.0, 9.0 });
        AbodDetector abod = AbodDetector.fast(10);
        assertTrue(abod.isFast());
        abod.fit(x);
        assertEquals(60, TestData.argmax(abod.getDecisionScores()));
    }

    @Test
    public void testQueryOrdering() {
        double[][] reference = TestData.gaussian(50, 2, 10L);
        double[][] query = { { 0.1, -0.2 }, { 12.0, 12.0 } };
        for (AbodDetector abod : new AbodDetector[] { AbodDetector.full(), AbodDetector.fast(8) }) {
            abod.fit(reference);
            double[] scores = abod.decisionFunction(query);
            assertTrue(scores[1] > scores[0], abod.getName());
        }
    }

    @Test
    public void testCoincidentPointsPolicy() {
        double[][] reference = TestData.gaussian(20, 2, 11L);

        AbodDetector strict = new AbodDetector("abod", false, 10, DegeneracyPolicy.FAIL, 0.1);
        strict.fit(reference);
        assertThrows(DegenerateDistributionException.class,
                () -> strict.decisionFunction(new double[][] { reference[4].clone() }));

        AbodDetector floored = new AbodDetector("abod", false, 10, DegeneracyPolicy.EPSILON_FLOOR, 0.1);
        floored.fit(reference);
        double score = floored.decisionFunction(new double[][] { reference[4].clone() })[0];
        assertTrue(Double.isFinite(score));
    }

    @Test
    public void testDuplicateTrainingRowsWithStrictPolicy() {
        double[][] x = TestData.gaussian(10, 2, 12L);
        x[9] = x[0].clone();
        AbodDetector strict = new AbodDetector("abod", false, 10, DegeneracyPolicy.FAIL, 0.1);
        assertThrows(DegenerateDistributionException.class, () -> strict.fit(x));
        assertFalse(strict.isFitted());
    }

    @Test
    public void testMinimumRows() {
        assertThrows(InvalidInputException.class, () -> AbodDetector.full().fit(TestData.gaussian(2, 2, 1L)));
        assertThrows(InvalidInputException.class, () -> AbodDetector.fast(5).fit(TestData.gaussian(5, 2, 1L)));
        assertThrows(InvalidInputException.class, () -> AbodDetector.fast(1));
    }
}
