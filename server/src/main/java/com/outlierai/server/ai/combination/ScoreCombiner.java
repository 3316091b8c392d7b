package com.outlierai.server.ai.combination;

import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * Combination policies over a normalized score matrix (rows = samples, columns = detectors).
 * Every method is a pure function returning a fresh score vector.
 */
public class ScoreCombiner {

    public static final String AVERAGE = "average";
    public static final String WEIGHTED_AVERAGE = "weighted_average";
    public static final String MAXIMIZATION = "maximization";
    public static final String MEDIAN = "median";
    public static final String AOM = "aom";
    public static final String MOA = "moa";
    public static final String THRESHOLD_SUM = "threshold_sum";

    /**
     * Applies the policy named by {@code method}.
     *
     * @param grouping  column groups, required by aom and moa only
     * @param weights   required by weighted_average, optional for threshold_sum
     * @param threshold global threshold for threshold_sum
     */
    public static double[] combine(String method, double[][] scores, ColumnGrouping grouping, double[] weights,
            double threshold) {
        switch (requireMethod(method)) {
            case AVERAGE:
                return average(scores);
            case WEIGHTED_AVERAGE:
                return weightedAverage(scores, weights);
            case MAXIMIZATION:
                return maximization(scores);
            case MEDIAN:
                return median(scores);
            case AOM:
                return aom(scores, requireGrouping(grouping, method));
            case MOA:
                return moa(scores, requireGrouping(grouping, method));
            case THRESHOLD_SUM:
            default:
                int m = MatrixUtil.requireMatrix(scores, "score matrix");
                double[] thresholds = new double[m];
                Arrays.fill(thresholds, threshold);
                return thresholdSum(scores, thresholds, weights);
        }
    }

    /**
     * @return the normalized method name
     */
    public static String requireMethod(String method) {
        String m = method != null ? method.trim().toLowerCase() : "";
        switch (m) {
            case AVERAGE:
            case WEIGHTED_AVERAGE:
            case MAXIMIZATION:
            case MEDIAN:
            case AOM:
            case MOA:
            case THRESHOLD_SUM:
                return m;
            default:
                throw new InvalidInputException("Unknown combination method: " + method);
        }
    }

    public static boolean usesGrouping(String method) {
        String m = requireMethod(method);
        return m.equals(AOM) || m.equals(MOA);
    }

    private static ColumnGrouping requireGrouping(ColumnGrouping grouping, String method) {
        if (grouping == null) {
            throw new InvalidInputException(method + " needs a column grouping");
        }
        return grouping;
    }

    public static double[] average(double[][] scores) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < m; j++) {
                sum += scores[i][j];
            }
            out[i] = sum / m;
        }
        return out;
    }

    /**
     * Row-wise mean of w_j * s_ij. Weights are not normalized; with all weights 1 this equals
     * {@link #average(double[][])}.
     */
    public static double[] weightedAverage(double[][] scores, double[] weights) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        MatrixUtil.requireVector(weights, "weights");
        if (weights.length != m) {
            throw new InvalidInputException("Expected " + m + " weights, got " + weights.length);
        }
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < m; j++) {
                sum += weights[j] * scores[i][j];
            }
            out[i] = sum / m;
        }
        return out;
    }

    public static double[] maximization(double[][] scores) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int j = 0; j < m; j++) {
                max = Math.max(max, scores[i][j]);
            }
            out[i] = max;
        }
        return out;
    }

    public static double[] median(double[][] scores) {
        MatrixUtil.requireMatrix(scores, "score matrix");
        Median median = new Median();
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            out[i] = median.evaluate(scores[i]);
        }
        return out;
    }

    /**
     * Average of maximum: row-wise maximum inside each column group, then the mean of the group
     * maxima. Each maximum is weighted by its group's share of the columns, which is the plain mean
     * when the groups are equal and keeps the result at or above the row average when a remainder
     * group is larger.
     */
    public static double[] aom(double[][] scores, int nBuckets, long seed) {
        return aom(scores, nBuckets, seed, false);
    }

    public static double[] aom(double[][] scores, int nBuckets, long seed, boolean remainderToLast) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        return aom(scores, ColumnGrouping.partition(m, nBuckets, seed, remainderToLast));
    }

    public static double[] aom(double[][] scores, ColumnGrouping grouping) {
        requireGroupingFits(scores, grouping);
        int[][] groups = grouping.groups();
        int m = scores[0].length;
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double sum = 0.0;
            for (int[] group : groups) {
                double max = Double.NEGATIVE_INFINITY;
                for (int j : group) {
                    max = Math.max(max, scores[i][j]);
                }
                sum += group.length * max;
            }
            out[i] = sum / m;
        }
        return out;
    }

    /**
     * Maximum of average: row-wise mean inside each column group, then the largest group mean.
     */
    public static double[] moa(double[][] scores, int nBuckets, long seed) {
        return moa(scores, nBuckets, seed, false);
    }

    public static double[] moa(double[][] scores, int nBuckets, long seed, boolean remainderToLast) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        return moa(scores, ColumnGrouping.partition(m, nBuckets, seed, remainderToLast));
    }

    public static double[] moa(double[][] scores, ColumnGrouping grouping) {
        requireGroupingFits(scores, grouping);
        int[][] groups = grouping.groups();
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int[] group : groups) {
                double sum = 0.0;
                for (int j : group) {
                    sum += scores[i][j];
                }
                max = Math.max(max, sum / group.length);
            }
            out[i] = max;
        }
        return out;
    }

    public static double[] thresholdSum(double[][] scores, double threshold) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        double[] thresholds = new double[m];
        Arrays.fill(thresholds, threshold);
        return thresholdSum(scores, thresholds, null);
    }

    /**
     * Per row, sum of w_j over the columns whose score is strictly above that column's threshold.
     * Null weights count every exceeding column as 1.
     */
    public static double[] thresholdSum(double[][] scores, double[] thresholds, double[] weights) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        if (thresholds == null || thresholds.length != m) {
            throw new InvalidInputException("Expected " + m + " thresholds");
        }
        if (weights != null && weights.length != m) {
            throw new InvalidInputException("Expected " + m + " weights, got " + weights.length);
        }
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < m; j++) {
                if (scores[i][j] > thresholds[j]) {
                    sum += weights != null ? weights[j] : 1.0;
                }
            }
            out[i] = sum;
        }
        return out;
    }

    /**
     * A row is an outlier when more than half of the detectors label it so.
     */
    public static int[] majorityVote(int[][] labels) {
        if (labels == null || labels.length == 0 || labels[0] == null || labels[0].length == 0) {
            throw new InvalidInputException("label matrix must not be empty");
        }
        int m = labels[0].length;
        int[] out = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == null || labels[i].length != m) {
                throw new InvalidInputException("label matrix is not rectangular at row " + i);
            }
            int votes = 0;
            for (int l : labels[i]) {
                votes += l;
            }
            out[i] = 2 * votes > m ? 1 : 0;
        }
        return out;
    }

    private static void requireGroupingFits(double[][] scores, ColumnGrouping grouping) {
        int m = MatrixUtil.requireMatrix(scores, "score matrix");
        int covered = 0;
        for (int[] group : grouping.groups()) {
            covered += group.length;
            for (int j : group) {
                if (j >= m) {
                    throw new InvalidInputException("Grouping refers to column " + j + " of a " + m
                            + "-column score matrix");
                }
            }
        }
        if (covered != m) {
            throw new InvalidInputException("Grouping covers " + covered + " columns, score matrix has " + m);
        }
    }
}
