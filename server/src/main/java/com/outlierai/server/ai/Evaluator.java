package com.outlierai.server.ai;

import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

/**
 * Ranking metrics over scores and ground-truth labels aligned by row index.
 */
public class Evaluator {

    /**
     * Area under the ROC curve via the rank-sum statistic, averaging ranks of tied scores.
     */
    public static double rocAuc(int[] y, double[] scores) {
        requireAligned(y, scores);
        int positives = countPositives(y);
        int negatives = y.length - positives;
        if (positives == 0 || negatives == 0) {
            throw new InvalidInputException("ROC AUC needs both inliers and outliers in the ground truth");
        }
        double[] ranks = new NaturalRanking(TiesStrategy.AVERAGE).rank(scores);
        double rankSum = 0.0;
        for (int i = 0; i < y.length; i++) {
            if (y[i] == Labeler.OUTLIER) {
                rankSum += ranks[i];
            }
        }
        double u = rankSum - positives * (positives + 1) / 2.0;
        return u / ((double) positives * negatives);
    }

    /**
     * Precision of the top-n scored rows, with n defaulting to the number of true outliers.
     */
    public static double precisionAtN(int[] y, double[] scores) {
        return precisionAtN(y, scores, countPositives(y));
    }

    public static double precisionAtN(int[] y, double[] scores, int n) {
        requireAligned(y, scores);
        if (n <= 0 || n > y.length) {
            throw new InvalidInputException("n must be in [1, " + y.length + "], got " + n);
        }
        double fraction = (double) n / y.length;
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(scores, 100.0 * (1.0 - fraction));
        int predicted = 0;
        int truePositives = 0;
        for (int i = 0; i < y.length; i++) {
            if (scores[i] >= threshold) {
                predicted++;
                if (y[i] == Labeler.OUTLIER) {
                    truePositives++;
                }
            }
        }
        return predicted == 0 ? 0.0 : (double) truePositives / predicted;
    }

    private static int countPositives(int[] y) {
        int positives = 0;
        for (int label : y) {
            if (label != Labeler.INLIER && label != Labeler.OUTLIER) {
                throw new InvalidInputException("Ground-truth labels must be 0 or 1, got " + label);
            }
            positives += label;
        }
        return positives;
    }

    private static void requireAligned(int[] y, double[] scores) {
        MatrixUtil.requireVector(scores, "scores");
        if (y == null || y.length != scores.length) {
            throw new InvalidInputException("Ground truth and scores must have the same length");
        }
    }
}
