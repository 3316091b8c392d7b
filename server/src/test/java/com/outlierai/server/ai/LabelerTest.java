package com.outlierai.server.ai;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class LabelerTest {

    @Test
    public void testThresholdInterpolatesLinearly() {
        double[] scores = { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0 };
        // 90th percentile of 1..10 with linear interpolation: 1 + 0.9 * 9
        assertEquals(9.1, Labeler.threshold(scores, 0.1), 1e-12);
        assertEquals(5.5, Labeler.threshold(scores, 0.5), 1e-12);
    }

    @Test
    public void testLabelsAreInclusiveAtThreshold() {
        double[] scores = { 0.0, 1.0, 2.0, 2.0, 2.0 };
        int[] labels = Labeler.label(scores, 2.0);
        assertArrayEquals(new int[] { 0, 0, 1, 1, 1 }, labels);
    }

    @Test
    public void testTiesMayExceedContaminationCount() {
        double[] scores = { 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0 };
        int[] labels = Labeler.labelByContamination(scores, 0.1);
        // every row sits exactly on the threshold
        assertEquals(10, Labeler.countOutliers(labels));
    }

    @Test
    public void testContaminationRange() {
        double[] scores = { 1.0, 2.0 };
        assertThrows(InvalidInputException.class, () -> Labeler.threshold(scores, 0.0));
        assertThrows(InvalidInputException.class, () -> Labeler.threshold(scores, 0.6));
        assertThrows(InvalidInputException.class, () -> Labeler.threshold(scores, -0.1));
        assertDoesNotThrow(() -> Labeler.threshold(scores, 0.5));
    }
}
