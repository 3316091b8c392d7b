package com.outlierai.server.ai.combination;

import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.DegenerateDistributionException;
import com.outlierai.server.ai.InvalidInputException;
import com.outlierai.util.MatrixUtil;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Per-column z-scores. Statistics come from the training score matrix only and are reused for
 * every other matrix, so normalized scores from different runs stay comparable.
 */
public class Standardizer {

    public static final double EPSILON = 1e-12;

    private final DegeneracyPolicy degeneracy;

    public Standardizer() {
        this(DegeneracyPolicy.FAIL);
    }

    public Standardizer(DegeneracyPolicy degeneracy) {
        this.degeneracy = degeneracy != null ? degeneracy : DegeneracyPolicy.FAIL;
    }

    public StandardizedScores fitTransform(double[][] train) {
        int m = MatrixUtil.requireMatrix(train, "training score matrix");
        double[] mean = new double[m];
        double[] std = new double[m];
        for (int j = 0; j < m; j++) {
            double[] col = MatrixUtil.column(train, j);
            mean[j] = StatUtils.mean(col);
            // population std, matching the usual z-score definition
            std[j] = Math.sqrt(StatUtils.populationVariance(col, mean[j]));
            if (std[j] == 0.0) {
                if (degeneracy == DegeneracyPolicy.FAIL) {
                    throw new DegenerateDistributionException("Score column " + j + " has zero variance");
                }
                std[j] = EPSILON;
            }
        }
        return new StandardizedScores(apply(train, mean, std), mean, std);
    }

    public double[][] transform(double[][] other, double[] mean, double[] std) {
        int m = MatrixUtil.requireMatrix(other, "score matrix");
        if (mean == null || std == null || mean.length != m || std.length != m) {
            throw new InvalidInputException("Statistics cover a different number of columns than the "
                    + m + "-column score matrix");
        }
        for (int j = 0; j < m; j++) {
            if (!(std[j] > 0.0)) {
                throw new DegenerateDistributionException("Standard deviation of column " + j + " is " + std[j]);
            }
        }
        return apply(other, mean, std);
    }

    /**
     * Normalizes both matrices with statistics fitted on {@code train}.
     *
     * @return {trainNorm, testNorm}
     */
    public double[][][] standardize(double[][] train, double[][] test) {
        StandardizedScores fitted = fitTransform(train);
        return new double[][][] { fitted.getNormalized(), transform(test, fitted.getMean(), fitted.getStd()) };
    }

    private static double[][] apply(double[][] x, double[] mean, double[] std) {
        double[][] out = new double[x.length][mean.length];
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < mean.length; j++) {
                out[i][j] = (x[i][j] - mean[j]) / std[j];
            }
        }
        return out;
    }
}
