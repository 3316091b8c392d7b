package com.outlierai.server.ai.detector;

import com.outlierai.server.ai.BaseDetector;
import com.outlierai.server.ai.DegeneracyPolicy;
import com.outlierai.server.ai.DegenerateDistributionException;
import com.outlierai.server.ai.DistanceOracle;
import com.outlierai.server.ai.InvalidInputException;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Angle-based outlier detection. For a point p and every pair (a, b) of reference points the
 * distance-weighted angle term &lt;a-p, b-p&gt; / (|a-p|^2 |b-p|^2) is collected; points in the
 * bulk of the data see other points in all directions and get a large variance, outliers a
 * small one. The score is the negated variance.
 *
 * The fast variant only pairs up the k nearest reference points, O(k^2) per point instead of
 * O(N^2).
 */
public class AbodDetector extends BaseDetector<double[][]> {
    private static final Logger logger = LoggerFactory.getLogger(AbodDetector.class);

    public static final int DEFAULT_N_NEIGHBORS = 10;
    public static final double SQUARED_NORM_FLOOR = 1e-12;

    private final boolean fast;
    private final int nNeighbors;
    private final DegeneracyPolicy degeneracy;
    private final DistanceOracle oracle = new DistanceOracle();

    public AbodDetector(String name, boolean fast, int nNeighbors, DegeneracyPolicy degeneracy,
            double contamination) {
        super(name, contamination);
        if (fast && nNeighbors < 2) {
            throw new InvalidInputException("FastABOD needs at least 2 neighbours, got " + nNeighbors);
        }
        this.fast = fast;
        this.nNeighbors = nNeighbors;
        this.degeneracy = degeneracy != null ? degeneracy : DegeneracyPolicy.EPSILON_FLOOR;
    }

    public static AbodDetector full() {
        return new AbodDetector("abod", false, DEFAULT_N_NEIGHBORS, DegeneracyPolicy.EPSILON_FLOOR, 0.1);
    }

    public static AbodDetector fast(int nNeighbors) {
        return new AbodDetector("fast_abod", true, nNeighbors, DegeneracyPolicy.EPSILON_FLOOR, 0.1);
    }

    public boolean isFast() {
        return fast;
    }

    @Override
    protected int minimumRows() {
        // a training point needs two other points to form one angle
        return fast ? nNeighbors + 1 : 3;
    }

    @Override
    protected double[][] buildModel(double[][] x) {
        return x;
    }

    @Override
    protected double[] scoreTraining(double[][] reference, double[][] x) {
        double[][] d = fast ? oracle.selfDistances(x) : null;
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            int[] neighbours = fast ? DistanceOracle.nearest(d[i], nNeighbors, i) : allExcept(x.length, i);
            scores[i] = angleScore(x[i], reference, neighbours);
        }
        logger.debug("{} scored {} training points ({} variant)", getName(), x.length, fast ? "fast" : "full");
        return scores;
    }

    @Override
    protected double[] score(double[][] reference, double[][] x) {
        double[][] d = fast ? oracle.distances(x, reference) : null;
        double[] scores = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            int[] neighbours = fast ? DistanceOracle.nearest(d[i], nNeighbors, -1)
                    : allExcept(reference.length, -1);
            scores[i] = angleScore(x[i], reference, neighbours);
        }
        return scores;
    }

    private static int[] allExcept(int n, int skip) {
        int[] idx = new int[skip >= 0 ? n - 1 : n];
        int k = 0;
        for (int j = 0; j < n; j++) {
            if (j != skip) {
                idx[k++] = j;
            }
        }
        return idx;
    }

    private double angleScore(double[] p, double[][] reference, int[] neighbours) {
        int m = neighbours.length;
        double[][] v = new double[m][];
        double[] sq = new double[m];
        for (int a = 0; a < m; a++) {
            double[] r = reference[neighbours[a]];
            v[a] = new double[p.length];
            double s = 0.0;
            for (int f = 0; f < p.length; f++) {
                v[a][f] = r[f] - p[f];
                s += v[a][f] * v[a][f];
            }
            if (s == 0.0) {
                if (degeneracy == DegeneracyPolicy.FAIL) {
                    throw new DegenerateDistributionException(
                            getName() + ": query point coincides with reference point " + neighbours[a]);
                }
                s = SQUARED_NORM_FLOOR;
            }
            sq[a] = s;
        }

        double[] terms = new double[m * (m - 1) / 2];
        int t = 0;
        for (int a = 0; a < m; a++) {
            for (int b = a + 1; b < m; b++) {
                double dot = 0.0;
                for (int f = 0; f < p.length; f++) {
                    dot += v[a][f] * v[b][f];
                }
                terms[t++] = dot / (sq[a] * sq[b]);
            }
        }
        return -StatUtils.populationVariance(terms);
    }
}
