package com.outlierai.server.ai;

import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Turns scores into binary labels through a contamination quantile.
 */
public class Labeler {

    public static final double DEFAULT_CONTAMINATION = 0.1;

    public static final int INLIER = 0;
    public static final int OUTLIER = 1;

    public static void requireContamination(double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new InvalidInputException("contamination must be in (0, 0.5], got " + contamination);
        }
    }

    /**
     * The (1 - contamination) quantile of the scores, interpolating linearly between order
     * statistics.
     */
    public static double threshold(double[] scores, double contamination) {
        requireContamination(contamination);
        MatrixUtil.requireVector(scores, "scores");
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(scores, 100.0 * (1.0 - contamination));
    }

    /**
     * Rows scoring at or above the threshold are outliers. Ties at the threshold all count, so the
     * number of outliers can exceed round(contamination * N).
     */
    public static int[] label(double[] scores, double threshold) {
        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = scores[i] >= threshold ? OUTLIER : INLIER;
        }
        return labels;
    }

    public static int[] labelByContamination(double[] scores, double contamination) {
        return label(scores, threshold(scores, contamination));
    }

    public static int countOutliers(int[] labels) {
        int count = 0;
        for (int l : labels) {
            if (l == OUTLIER) {
                count++;
            }
        }
        return count;
    }
}
