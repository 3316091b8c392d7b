package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.EvaluationResult;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.server.ai.NotFittedException;
import com.outlierai.server.ai.ProbabilityMethod;
import com.outlierai.server.ai.TestData;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class KnnDetectorTest {

    @Test
    public void testFarPointsRankTopAmongGaussianQueries() {
        double[][] reference = TestData.gaussian(100, 2, 42L);
        double[][] query = TestData.gaussianWith(10, 2, 7L, new double[] { 10, 10 }, new double[] { 10, 10 });

        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.LARGEST);
        knn.fit(reference);
        double[] scores = knn.decisionFunction(query);

        assertEquals(12, scores.length);
        int[] top = TestData.topK(scores, 2);
        Arrays.sort(top);
        assertArrayEquals(new int[] { 10, 11 }, top);
    }

    @Test
    public void testCopyOfReferenceRowScoresBelowFarRow() {
        double[][] reference = TestData.gaussian(50, 3, 5L);
        KnnDetector knn = new KnnDetector(3, KnnDetector.Method.LARGEST);
        knn.fit(reference);

        double[] scores = knn.decisionFunction(new double[][] { reference[17].clone(), { 20.0, -20.0, 20.0 } });
        assertTrue(scores[0] <= scores[1]);
    }

    @Test
    public void testMethodsOnKnownDistances() {
        double[][] reference = { { 0.0 }, { 1.0 }, { 3.0 }, { 6.0 } };
        double[][] query = { { 0.0 } };

        KnnDetector largest = new KnnDetector("largest", 3, KnnDetector.Method.LARGEST, "euclidean", 0.1);
        KnnDetector mean = new KnnDetector("mean", 3, KnnDetector.Method.MEAN, "euclidean", 0.1);
        KnnDetector median = new KnnDetector("median", 3, KnnDetector.Method.MEDIAN, "euclidean", 0.1);
        largest.fit(reference);
        mean.fit(reference);
        median.fit(reference);

        assertEquals(3.0, largest.decisionFunction(query)[0], 1e-12);
        assertEquals(4.0 / 3.0, mean.decisionFunction(query)[0], 1e-12);
        assertEquals(1.0, median.decisionFunction(query)[0], 1e-12);
    }

    @Test
    public void testTrainingScoresLeaveRowOut() {
        KnnDetector knn = new KnnDetector(1, KnnDetector.Method.LARGEST);
        knn.fit(new double[][] { { 0.0 }, { 1.0 }, { 3.0 } });
        assertArrayEquals(new double[] { 1.0, 1.0, 2.0 }, knn.getDecisionScores(), 1e-12);
    }

    @Test
    public void testPredictThresholdsAtStoredThreshold() {
        double[][] reference = new double[10][1];
        for (int i = 0; i < 10; i++) {
            reference[i][0] = i;
        }
        KnnDetector knn = new KnnDetector("knn", 1, KnnDetector.Method.LARGEST, "euclidean", 0.1);
        knn.fit(reference);

        // every training row is exactly 1.0 away from its nearest neighbour
        assertEquals(1.0, knn.getThreshold(), 0.0);
        assertArrayEquals(new int[] { 1, 1, 1, 1, 1, 1, 1, 1, 1, 1 }, knn.getLabels());

        double[][] query = { { 0.5 }, { -1.0 }, { 11.0 } };
        assertArrayEquals(new double[] { 0.5, 1.0, 2.0 }, knn.decisionFunction(query), 1e-12);
        // -1.0 scores exactly at the threshold and counts as an outlier
        assertArrayEquals(new int[] { 0, 1, 1 }, knn.predict(query));
    }

    @Test
    public void testPredictIsThresholdedDecisionFunction() {
        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.MEAN);
        knn.fit(TestData.gaussian(80, 2, 3L));
        double[][] query = TestData.gaussian(40, 2, 4L);

        double[] scores = knn.decisionFunction(query);
        int[] labels = knn.predict(query);
        for (int i = 0; i < query.length; i++) {
            assertEquals(scores[i] >= knn.getThreshold() ? 1 : 0, labels[i]);
        }
    }

    @Test
    public void testScoringBeforeFitFails() {
        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.LARGEST);
        double[][] x = { { 1.0, 2.0 } };
        assertFalse(knn.isFitted());
        assertThrows(NotFittedException.class, () -> knn.decisionFunction(x));
        assertThrows(NotFittedException.class, () -> knn.predict(x));
        assertThrows(NotFittedException.class, () -> knn.predictProba(x));
        assertThrows(NotFittedException.class, () -> knn.predictRank(x));
        assertThrows(NotFittedException.class, knn::getDecisionScores);
    }

    @Test
    public void testFailedFitLeavesPreviousState() {
        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.LARGEST);
        assertThrows(InvalidInputException.class, () -> knn.fit(TestData.gaussian(5, 2, 1L)));
        assertFalse(knn.isFitted());

        knn.fit(TestData.gaussian(30, 2, 1L));
        double threshold = knn.getThreshold();
        double[] scores = knn.getDecisionScores();

        assertThrows(InvalidInputException.class, () -> knn.fit(TestData.gaussian(3, 2, 2L)));
        assertTrue(knn.isFitted());
        assertEquals(threshold, knn.getThreshold(), 0.0);
        assertArrayEquals(scores, knn.getDecisionScores(), 0.0);
    }

    @Test
    public void testRefitReplacesState() {
        KnnDetector knn = new KnnDetector(3, KnnDetector.Method.LARGEST);
        knn.fit(TestData.gaussian(30, 2, 1L));
        knn.fit(TestData.gaussian(12, 2, 2L));
        assertEquals(12, knn.getDecisionScores().length);
        assertEquals(12, knn.getLabels().length);
    }

    @Test
    public void testQueryWithOtherDimensionIsRejected() {
        KnnDetector knn = new KnnDetector(3, KnnDetector.Method.LARGEST);
        knn.fit(TestData.gaussian(30, 2, 1L));
        assertThrows(InvalidInputException.class, () -> knn.decisionFunction(new double[][] { { 1.0, 2.0, 3.0 } }));
    }

    @Test
    public void testProbabilityAndRank() {
        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.LARGEST);
        knn.fit(TestData.gaussian(100, 2, 9L));
        double[][] query = TestData.gaussianWith(20, 2, 10L, new double[] { 15.0, 15.0 });

        for (ProbabilityMethod method : ProbabilityMethod.values()) {
            double[] proba = knn.predictProba(query, method);
            for (double p : proba) {
                assertTrue(p >= 0.0 && p <= 1.0, method + " gave " + p);
            }
            assertEquals(1.0, proba[20], 1e-9, method.name());
        }

        double[] ranks = knn.predictRank(query);
        for (double r : ranks) {
            assertTrue(r > 0.0 && r <= 1.0);
        }
        // above every training score
        assertEquals(1.0, ranks[20], 0.0);
    }

    @Test
    public void testFitPredictEvaluate() {
        double[][] x = TestData.gaussianWith(95, 2, 21L,
                new double[] { 8, 8 }, new double[] { -8, 8 }, new double[] { 8, -8 },
                new double[] { -8, -8 }, new double[] { 0, 12 });
        int[] y = new int[100];
        for (int i = 95; i < 100; i++) {
            y[i] = 1;
        }

        KnnDetector knn = new KnnDetector(5, KnnDetector.Method.LARGEST);
        EvaluationResult result = knn.fitPredictEvaluate(x, y);

        assertEquals(100, result.getLabels().length);
        assertTrue(result.getRocAuc() > 0.95, "roc " + result.getRocAuc());
        assertEquals(1.0, result.getPrecisionAtN(), 1e-12);
        assertArrayEquals(knn.getLabels(), knn.fitPredict(x));
    }
}
